package me.matrixwarden.bot.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory homeserver stand-in for adapter tests.
 * <p>
 * Installed as an OkHttp interceptor, it never touches the network. Tests
 * enqueue JSON replies (or I/O failures) in call order and inspect the captured
 * requests afterwards.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<PlannedReply> plannedReplies = new ConcurrentLinkedQueue<>();
    private final List<CapturedRequest> capturedRequests = new ArrayList<>();

    public void enqueueJson(int code, String body) {
        plannedReplies.add(new PlannedReply(code, body != null ? body : "", null));
    }

    /**
     * Enqueues a Matrix standard error body.
     */
    public void enqueueMatrixError(int code, String errcode, String error) {
        enqueueJson(code, "{\"errcode\":\"" + errcode + "\",\"error\":\"" + error + "\"}");
    }

    public void enqueueFailure(IOException failure) {
        plannedReplies.add(new PlannedReply(0, "", failure));
    }

    public synchronized List<CapturedRequest> requests() {
        return List.copyOf(capturedRequests);
    }

    public synchronized CapturedRequest lastRequest() {
        return capturedRequests.isEmpty() ? null : capturedRequests.get(capturedRequests.size() - 1);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        synchronized (this) {
            capturedRequests.add(new CapturedRequest(request, readBody(request)));
        }

        PlannedReply reply = plannedReplies.poll();
        if (reply == null) {
            throw new IOException("No planned reply for " + request.method() + " " + request.url());
        }
        if (reply.failure() != null) {
            throw reply.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("mock")
                .body(ResponseBody.create(reply.body(), JSON))
                .build();
    }

    private String readBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record PlannedReply(int code, String body, IOException failure) {
    }

    public static final class CapturedRequest {
        private final Request request;
        private final String body;

        private CapturedRequest(Request request, String body) {
            this.request = request;
            this.body = body;
        }

        public String method() {
            return request.method();
        }

        public String path() {
            return request.url().encodedPath();
        }

        public String queryParameter(String name) {
            return request.url().queryParameter(name);
        }

        public String header(String name) {
            return request.header(name);
        }

        public String body() {
            return body;
        }
    }
}
