package com.example.storelab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StoreLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoreLabApplication.class, args);
    }
}
