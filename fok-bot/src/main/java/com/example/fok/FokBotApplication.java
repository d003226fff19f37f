package com.example.fok;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FokBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(FokBotApplication.class, args);
    }
}
