package com.spring.listentogether;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ListenTogetherApplication {

    public static void main(String[] args) {
        SpringApplication.run(ListenTogetherApplication.class, args);
    }
}
