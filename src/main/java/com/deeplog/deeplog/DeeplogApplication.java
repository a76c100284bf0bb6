package com.deeplog.deeplog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeeplogApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeeplogApplication.class, args);
    }
}
