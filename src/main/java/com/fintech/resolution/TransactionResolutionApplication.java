package com.fintech.resolution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Transaction Resolution Service
 * <p>
 * Works out which card transaction a user is talking about from a loose
 * description ("the $50 coffee last Tuesday") and files disputes against it.
 * <p>
 * Key Features:
 * - Fuzzy matching on amount, date and merchant with configurable tolerances
 * - Clarification turns when several transactions fit equally well
 * - Rate limiting, circuit breaking and retries around every outbound provider call
 * - Audit trail with hashed user ids, plus metrics and logging
 */
@SpringBootApplication
@EnableScheduling
public class TransactionResolutionApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionResolutionApplication.class, args);
    }
}
