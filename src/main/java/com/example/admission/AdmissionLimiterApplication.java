package com.example.admission;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdmissionLimiterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdmissionLimiterApplication.class, args);
    }
}
