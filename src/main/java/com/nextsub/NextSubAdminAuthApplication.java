package com.nextsub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NextSubAdminAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(NextSubAdminAuthApplication.class, args);
    }
}
