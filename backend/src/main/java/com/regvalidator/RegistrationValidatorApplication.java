package com.regvalidator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegistrationValidatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegistrationValidatorApplication.class, args);
    }
}
