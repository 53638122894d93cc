package ru.tigran.stylistengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StylistEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(StylistEngineApplication.class, args);
    }
}
