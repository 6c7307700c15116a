package com.lastmile.locationtracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * Delivery Location Tracking & Geofence Event Engine
 */
@SpringBootApplication
public class LocationTrackingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LocationTrackingApplication.class, args);
    }

}
