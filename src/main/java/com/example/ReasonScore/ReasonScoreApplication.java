package com.example.ReasonScore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReasonScoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReasonScoreApplication.class, args);
    }
}
