package com.vedant.analyticsbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnalyticsBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsBotApplication.class, args);
    }
}
