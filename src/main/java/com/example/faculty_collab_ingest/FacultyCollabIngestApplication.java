package com.example.faculty_collab_ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FacultyCollabIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(FacultyCollabIngestApplication.class, args);
    }
}
