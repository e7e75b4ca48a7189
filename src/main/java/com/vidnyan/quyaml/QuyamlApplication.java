package com.vidnyan.quyaml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * QuYAML - restricted circuit-description compiler.
 *
 * Loads QuYAML text safely and lowers it into circuit-builder calls.
 */
@SpringBootApplication
public class QuyamlApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuyamlApplication.class, args);
    }
}
