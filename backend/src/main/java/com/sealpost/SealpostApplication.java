package com.sealpost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SealpostApplication {

    public static void main(String[] args) {
        SpringApplication.run(SealpostApplication.class, args);
    }
}
