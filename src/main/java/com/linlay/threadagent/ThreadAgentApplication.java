package com.linlay.threadagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThreadAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreadAgentApplication.class, args);
    }
}
