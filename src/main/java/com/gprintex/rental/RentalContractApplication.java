package com.gprintex.rental;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RentalContractApplication {

    public static void main(String[] args) {
        SpringApplication.run(RentalContractApplication.class, args);
    }
}
