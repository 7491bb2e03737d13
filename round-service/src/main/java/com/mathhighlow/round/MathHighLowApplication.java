package com.mathhighlow.round;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MathHighLowApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathHighLowApplication.class, args);
    }
}
