package com.supersoft.photonest.media_import_processor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaImportProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaImportProcessorApplication.class, args);
    }
}
