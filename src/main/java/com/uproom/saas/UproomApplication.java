package com.uproom.saas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UproomApplication {
    public static void main(String[] args) {
        SpringApplication.run(UproomApplication.class, args);
    }
}
