package com.example.dealdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DealDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealDeskApplication.class, args);
    }
}
