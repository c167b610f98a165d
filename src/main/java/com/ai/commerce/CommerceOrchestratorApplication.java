package com.ai.commerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.ai.commerce")
public class CommerceOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommerceOrchestratorApplication.class, args);
    }
}
