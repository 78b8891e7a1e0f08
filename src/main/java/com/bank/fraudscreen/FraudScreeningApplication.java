package com.bank.fraudscreen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FraudScreeningApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudScreeningApplication.class, args);
    }
}
