package com.riskmodels;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RiskModelLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskModelLifecycleApplication.class, args);
    }
}
