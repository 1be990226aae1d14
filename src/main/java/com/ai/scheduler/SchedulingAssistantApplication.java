package com.ai.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.ai.scheduler")
public class SchedulingAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedulingAssistantApplication.class, args);
    }
}
