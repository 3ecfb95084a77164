package com.purchasingpower.fullcycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FullCycleApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FullCycleApplication.class, args)));
    }
}
