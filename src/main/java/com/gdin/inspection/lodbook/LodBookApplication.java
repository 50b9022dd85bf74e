package com.gdin.inspection.lodbook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LodBookApplication {

    public static void main(String[] args) {
        SpringApplication.run(LodBookApplication.class, args);
    }
}
