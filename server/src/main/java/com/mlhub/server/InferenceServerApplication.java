package com.mlhub.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InferenceServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InferenceServerApplication.class, args);
    }
}
