package com.elssolution.energymonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EnergyMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyMonitorApplication.class, args);
    }

}
