package com.example.goserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class GoServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoServerApplication.class, args);
    }

}
