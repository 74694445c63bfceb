package com.eainde.alignment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AlignmentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlignmentEngineApplication.class, args);
    }
}
