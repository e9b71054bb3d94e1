package com.partselect.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApplianceAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApplianceAssistantApplication.class, args);
    }
}
