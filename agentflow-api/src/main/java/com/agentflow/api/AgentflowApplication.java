package com.agentflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the agent orchestrator.
 */
@SpringBootApplication
public class AgentflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentflowApplication.class, args);
    }
}
