package com.example.preload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PreloadApplication {

    public static void main(String[] args) {
        SpringApplication.run(PreloadApplication.class, args);
    }
}
