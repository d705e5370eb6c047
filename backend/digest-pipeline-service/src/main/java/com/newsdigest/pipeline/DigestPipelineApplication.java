package com.newsdigest.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DigestPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DigestPipelineApplication.class, args);
    }
}
