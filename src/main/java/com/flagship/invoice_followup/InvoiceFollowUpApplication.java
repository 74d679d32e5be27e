package com.flagship.invoice_followup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the invoice follow-up service.
 *
 * Runs the due-window scanner and dispatch worker on a fixed interval, keeps the
 * accounting-system credentials fresh, and exposes a small admin API.
 */
@SpringBootApplication
@EnableScheduling
public class InvoiceFollowUpApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceFollowUpApplication.class, args);
    }
}
