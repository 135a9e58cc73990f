package com.aquiferai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AquiferAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AquiferAiApplication.class, args);
    }
}
