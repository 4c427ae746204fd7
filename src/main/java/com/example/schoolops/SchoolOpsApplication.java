package com.example.schoolops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchoolOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchoolOpsApplication.class, args);
    }
}
