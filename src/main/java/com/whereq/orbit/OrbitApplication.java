package com.whereq.orbit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Orbit.
 * This service admits GPU jobs against per-project quotas, queues them by priority
 * and runs them as Kubernetes Jobs.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class OrbitApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrbitApplication.class, args);
    }
}
