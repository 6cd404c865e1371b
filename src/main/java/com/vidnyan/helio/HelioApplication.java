package com.vidnyan.helio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Helio - route extraction and specification conformance verification for microservices.
 */
@SpringBootApplication
public class HelioApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HelioApplication.class, args)));
    }
}
