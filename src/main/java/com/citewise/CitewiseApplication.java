package com.citewise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Citewise - bounded-cost web research with a single cited summary.
 */
@SpringBootApplication
public class CitewiseApplication {

    public static void main(String[] args) {
        SpringApplication.run(CitewiseApplication.class, args);
    }
}
