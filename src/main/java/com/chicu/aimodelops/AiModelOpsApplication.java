package com.chicu.aimodelops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiModelOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiModelOpsApplication.class, args);
    }
}
