package com.geevly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GeevlyApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeevlyApplication.class, args);
    }
}
