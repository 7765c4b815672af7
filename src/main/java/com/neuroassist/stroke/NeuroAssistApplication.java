package com.neuroassist.stroke;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NeuroAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(NeuroAssistApplication.class, args);
    }
}
