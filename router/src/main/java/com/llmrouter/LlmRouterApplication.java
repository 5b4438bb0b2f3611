package com.llmrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LlmRouterApplication {
    public static void main(String[] args) {
        SpringApplication.run(LlmRouterApplication.class, args);
    }
}
