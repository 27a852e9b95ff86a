package com.dnobretech.contentalignerbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentAlignerBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentAlignerBackendApplication.class, args);
    }
}
