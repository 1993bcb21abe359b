package com.example.voice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ConversationControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConversationControlApplication.class, args);
    }
}
