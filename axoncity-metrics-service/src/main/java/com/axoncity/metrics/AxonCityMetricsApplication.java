package com.axoncity.metrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AxonCityMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AxonCityMetricsApplication.class, args);
    }
}
