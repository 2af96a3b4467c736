package com.anomalywatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnomalyWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyWatchApplication.class, args);
    }
}
