package com.aurea.reference.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Reference service that wires the analytics controllers, storage and core engine. */
@SpringBootApplication(scanBasePackages = {"com.aurea.controller", "com.aurea.service"})
public class AureaApplication {

    public static void main(String[] args) {
        SpringApplication.run(AureaApplication.class, args);
    }
}
