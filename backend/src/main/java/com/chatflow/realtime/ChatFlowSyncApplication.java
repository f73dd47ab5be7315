package com.chatflow.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ChatFlow realtime sync server.
 * Main entry point for the Spring Boot application.
 */
@EnableScheduling
@SpringBootApplication
public class ChatFlowSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatFlowSyncApplication.class, args);
    }
}
