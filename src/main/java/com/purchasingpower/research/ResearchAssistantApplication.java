package com.purchasingpower.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResearchAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchAssistantApplication.class, args);
    }
}
