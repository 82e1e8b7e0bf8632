package com.ewas.alerting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;


/**
 * Spring Boot application running the early-warning detection pipeline.
 */
@SpringBootApplication
@EnableScheduling
public class AlertPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertPipelineApplication.class, args);
    }
}
