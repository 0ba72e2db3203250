package com.vidnyan.sysml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SysML Model Engine
 *
 * Builds the semantic model of KerML/SysML syntax trees against the standard library.
 */
@SpringBootApplication
public class SysmlApplication {

    public static void main(String[] args) {
        SpringApplication.run(SysmlApplication.class, args);
    }
}
