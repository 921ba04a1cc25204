package com.example.faculty_collab_ingest.dto;

public enum VerificationStatus {
    MATCH,
    MISMATCH,
    ERROR
}
