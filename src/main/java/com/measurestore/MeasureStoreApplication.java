package com.measurestore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeasureStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeasureStoreApplication.class, args);
    }
}
