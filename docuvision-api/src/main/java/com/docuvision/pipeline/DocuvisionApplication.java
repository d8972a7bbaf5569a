package com.docuvision.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocuvisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocuvisionApplication.class, args);
    }
}
