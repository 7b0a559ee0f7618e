package com.daquv.agentstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentStreamApplication.class, args);
    }
}
