package com.piratebomb.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameCacheApplication.class, args);
    }
}
