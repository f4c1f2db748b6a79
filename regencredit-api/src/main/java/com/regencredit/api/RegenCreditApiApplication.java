package com.regencredit.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Regeneration credit protocol API.
 */
@SpringBootApplication(scanBasePackages = "com.regencredit")
public class RegenCreditApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegenCreditApiApplication.class, args);
    }
}
