package com.watchflixx.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WatchFlixxGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatchFlixxGatewayApplication.class, args);
    }

}
