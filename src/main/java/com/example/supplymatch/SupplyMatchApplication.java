package com.example.supplymatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point.
 * This class only wires the application context and hands over control to Spring; the HTTP
 * endpoints live under the interfaces layer.
 */
@SpringBootApplication
public class SupplyMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SupplyMatchApplication.class, args);
    }

}
