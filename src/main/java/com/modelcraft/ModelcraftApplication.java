package com.modelcraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelcraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelcraftApplication.class, args);
    }
}
