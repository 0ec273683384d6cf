package com.faultguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FaultguardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaultguardApplication.class, args);
    }
}
