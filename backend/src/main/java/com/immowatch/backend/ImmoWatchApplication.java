package com.immowatch.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImmoWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImmoWatchApplication.class, args);
    }
}
