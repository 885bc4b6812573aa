package com.agentfederation.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FederationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FederationServiceApplication.class, args);
    }
}
