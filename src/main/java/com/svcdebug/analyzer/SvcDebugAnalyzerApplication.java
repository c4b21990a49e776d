package com.svcdebug.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SvcDebugAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SvcDebugAnalyzerApplication.class, args);
    }
}
