package com.helix.guardrails;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HelixGuardrailsApplication {

    public static void main(String[] args) {
        SpringApplication.run(HelixGuardrailsApplication.class, args);
    }
}
