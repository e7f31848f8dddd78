package com.kreasipositif.ledgerimporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class LedgerImporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerImporterApplication.class, args);
    }
}
