package com.starscope.signals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StarscopeSignalsApplication {
    public static void main(String[] args) {
        SpringApplication.run(StarscopeSignalsApplication.class, args);
    }
}
