package com.researchplatform.webresearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WebResearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebResearchApplication.class, args);
    }
}
