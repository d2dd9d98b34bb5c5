package com.eainde.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentPlannerApplication.class, args);
    }
}
