package com.example.marketplace.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketplaceChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketplaceChatApplication.class, args);
    }
}
