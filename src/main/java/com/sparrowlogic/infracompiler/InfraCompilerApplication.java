package com.sparrowlogic.infracompiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InfraCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfraCompilerApplication.class, args);
    }
}
