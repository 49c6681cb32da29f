package dev.medimatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the medimatch identification service.
 *
 * <p>Hosts the matching engine behind a small REST surface for the mobile client; the engine
 * itself ({@code identify}, {@code matching}, {@code signal}) is usable without the web layer.
 */
@SpringBootApplication
public class MedimatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(MedimatchApplication.class, args);
    }
}
