package com.subtrack.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SubtrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubtrackApplication.class, args);
    }
}
