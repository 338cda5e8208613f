package com.herzen.practice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PracticeEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(PracticeEngineApplication.class, args);
    }
}
