package com.pgstress.service;

import org.springframework.boot.ExitCodeGenerator;

/**
 * The target database cannot take the workload; the run aborts before any work.
 *
 * <p>Spring Boot turns this exception into the process exit code.
 */
public class DatabaseUnavailableException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 1;

    public DatabaseUnavailableException(String message) {
        super(message);
    }

    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
