package com.example.EV_Charging_Platform;

import com.example.EV_Charging_Platform.config.PlatformProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PlatformProperties.class)
public class EvChargingPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvChargingPlatformApplication.class, args);
    }
}
