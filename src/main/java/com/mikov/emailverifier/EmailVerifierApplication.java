package com.mikov.emailverifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmailVerifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailVerifierApplication.class, args);
    }
}
