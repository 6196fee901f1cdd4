package com.vybescope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VybeScopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VybeScopeApplication.class, args);
    }
}
