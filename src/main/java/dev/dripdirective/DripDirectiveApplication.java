package dev.dripdirective;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the Drip Directive recommendation engine.
 *
 * <p>Runs without a web server; the engine and indexing services are exposed as Spring beans to
 * the calling orchestrator.
 */
@SpringBootApplication
@EnableRetry
@ConfigurationPropertiesScan
public class DripDirectiveApplication {
    public static void main(String[] args) {
        SpringApplication.run(DripDirectiveApplication.class, args);
    }
}
