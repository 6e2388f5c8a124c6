package com.openavail.availability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.openavail.availability", "com.openavail.common"})
public class AvailabilityServiceApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AvailabilityServiceApplication.class, args)));
    }
}
