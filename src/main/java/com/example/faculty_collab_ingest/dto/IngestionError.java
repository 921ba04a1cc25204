package com.example.faculty_collab_ingest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionError {
    private String sourcePid;
    private String dblpKey;
    private String message;
}
