package com.timemarket.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TimeMarket Platform API Application
 *
 * Confidential time-slot marketplace served from an in-process ledger.
 */
@SpringBootApplication(scanBasePackages = "com.timemarket")
public class TimeMarketApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeMarketApiApplication.class, args);
    }
}
