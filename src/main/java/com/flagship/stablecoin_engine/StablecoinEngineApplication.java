package com.flagship.stablecoin_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StablecoinEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(StablecoinEngineApplication.class, args);
    }
}
