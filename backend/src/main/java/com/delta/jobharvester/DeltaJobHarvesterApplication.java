package com.delta.jobharvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaJobHarvesterApplication {
    public static void main(String[] args) {
        SpringApplication.run(DeltaJobHarvesterApplication.class, args);
    }
}
