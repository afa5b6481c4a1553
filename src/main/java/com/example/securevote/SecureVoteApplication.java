package com.example.securevote;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SecureVoteApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecureVoteApplication.class, args);
    }
}
