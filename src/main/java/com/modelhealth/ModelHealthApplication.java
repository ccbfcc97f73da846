package com.modelhealth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelHealthApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelHealthApplication.class, args);
    }
}
