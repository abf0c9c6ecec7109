package com.brokerage.revshare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RevshareServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RevshareServiceApplication.class, args);
    }
}
