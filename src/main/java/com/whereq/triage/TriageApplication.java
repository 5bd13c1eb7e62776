package com.whereq.triage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Triage.
 * This service assigns uploaded Excel files to analysis queues by size, complexity and user tier,
 * and keeps the queues balanced under load.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class TriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageApplication.class, args);
    }
}
