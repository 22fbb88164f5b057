package com.autoya.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the AutoYa rental backend.
 *
 * Exposes CRUD endpoints for vehicles, owners, renters and rental
 * agreements under /api/v1.
 */
@SpringBootApplication
@EnableTransactionManagement
public class AutoyaBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoyaBackendApplication.class, args);
    }
}
