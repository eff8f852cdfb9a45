package com.flagship.inventory_valuation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InventoryValuationApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryValuationApplication.class, args);
    }
}
