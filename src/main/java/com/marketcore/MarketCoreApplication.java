package com.marketcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketCoreApplication.class, args);
    }
}
