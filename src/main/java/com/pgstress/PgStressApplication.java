package com.pgstress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for PostgreSQL cluster stress testing.
 *
 * <p>Creates randomly shaped tables, fills them from a pool of parallel
 * workers, then updates and samples them, against the write endpoint of a
 * cluster (typically a proxy routing to the leader).
 */
@SpringBootApplication
public class PgStressApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command-line arguments, e.g. {@code --tables=20 --rows=5000 --threads=8}
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PgStressApplication.class, args)));
    }
}
