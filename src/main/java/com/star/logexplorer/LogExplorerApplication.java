package com.star.logexplorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogExplorerApplication.class, args);
    }
}
