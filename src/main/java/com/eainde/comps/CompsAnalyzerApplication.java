package com.eainde.comps;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CompsAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompsAnalyzerApplication.class, args);
    }
}
