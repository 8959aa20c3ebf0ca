package com.underwriting.propertydata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PropertyDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertyDataApplication.class, args);
    }
}
