package com.purchasingpower.flowlint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowLintApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowLintApplication.class, args);
    }
}
