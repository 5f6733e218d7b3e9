package com.catalogenricher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogEnricherApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogEnricherApplication.class, args);
    }
}
