package com.kitchensync.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KitchenSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(KitchenSyncApplication.class, args);
    }
}
