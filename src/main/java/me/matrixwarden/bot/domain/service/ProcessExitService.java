package me.matrixwarden.bot.domain.service;

import org.springframework.stereotype.Service;

@Service
public class ProcessExitService {

    public static final int EXIT_OK = 0;
    public static final int EXIT_PROVISIONING_FAILED = 1;

    @SuppressWarnings({ "PMD.DoNotTerminateVM", "java:S1147" })
    public void exit(int statusCode) {
        System.exit(statusCode); // NOSONAR
    }
}
