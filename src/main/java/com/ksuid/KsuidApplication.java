package com.ksuid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KsuidApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(KsuidApplication.class, args)));
    }
}
