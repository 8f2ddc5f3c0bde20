package com.healthsync.vitals;

import com.healthsync.vitals.config.VitalsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(VitalsProperties.class)
public class VitalsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(VitalsServiceApplication.class, args);
    }
}
