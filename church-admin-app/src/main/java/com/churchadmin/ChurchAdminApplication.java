package com.churchadmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChurchAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChurchAdminApplication.class, args);
    }
}
