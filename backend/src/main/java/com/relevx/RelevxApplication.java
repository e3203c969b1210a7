package com.relevx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RelevxApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelevxApplication.class, args);
    }
}
