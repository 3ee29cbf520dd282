package com.streamfirst.mosaic.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point of the mosaic engine.
 */
@SpringBootApplication
@EnableConfigurationProperties(MosaicProperties.class)
public class MosaicApplication {

    public static void main(String[] args) {
        SpringApplication.run(MosaicApplication.class, args);
    }
}
