package com.lnradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LnRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(LnRadarApplication.class, args);
    }
}
