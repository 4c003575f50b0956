package dev.larder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Larder recipe import service.
 *
 * <p>Discovers recipes on supported sites, parses the selected ones and imports them into the
 * catalog after ingredient and tag validation.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LarderApplication {
    public static void main(String[] args) {
        SpringApplication.run(LarderApplication.class, args);
    }
}
