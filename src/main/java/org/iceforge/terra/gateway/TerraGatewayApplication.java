package org.iceforge.terra.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TerraGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TerraGatewayApplication.class, args);
    }
}
