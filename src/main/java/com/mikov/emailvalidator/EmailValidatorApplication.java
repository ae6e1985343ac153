package com.mikov.emailvalidator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmailValidatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailValidatorApplication.class, args);
    }
}
