package com.storefront.request_gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RequestGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RequestGatewayApplication.class, args);
    }
}
