package com.policysync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PolicySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicySyncApplication.class, args);
    }
}
