package com.caltrack.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaltrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaltrackApplication.class, args);
    }
}
