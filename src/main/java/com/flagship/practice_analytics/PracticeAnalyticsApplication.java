package com.flagship.practice_analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PracticeAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PracticeAnalyticsApplication.class, args);
    }
}
