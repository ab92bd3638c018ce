package com.example.umarell;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UmarellApplication {

    public static void main(String[] args) {
        SpringApplication.run(UmarellApplication.class, args);
    }
}
