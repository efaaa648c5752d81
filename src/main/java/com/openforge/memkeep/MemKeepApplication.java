package com.openforge.memkeep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// Every agent.* properties record is picked up by the scan, so components can
// inject them without repeating @EnableConfigurationProperties.
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemKeepApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemKeepApplication.class, args);
    }
}
