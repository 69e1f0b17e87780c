package com.shlawgathon.sentientloop.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SentientLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentientLoopApplication.class, args);
    }
}
