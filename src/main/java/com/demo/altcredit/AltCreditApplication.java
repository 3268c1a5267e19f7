package com.demo.altcredit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AltCreditApplication {

    public static void main(String[] args) {
        SpringApplication.run(AltCreditApplication.class, args);
    }
}
