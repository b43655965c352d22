package com.fieldvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FieldVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldVaultApplication.class, args);
    }
}
