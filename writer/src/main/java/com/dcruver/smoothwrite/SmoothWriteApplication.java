package com.dcruver.smoothwrite;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Smooth Write.
 *
 * A personal note-taking tool. Notes are stored one JSON file each and
 * saved automatically a moment after editing stops. The interactive shell
 * is the front end.
 */
@SpringBootApplication
@Slf4j
public class SmoothWriteApplication {

    public static void main(String[] args) {
        log.info("Starting Smooth Write...");
        SpringApplication.run(SmoothWriteApplication.class, args);
    }
}
