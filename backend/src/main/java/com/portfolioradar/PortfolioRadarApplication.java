package com.portfolioradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioRadarApplication.class, args);
    }
}
