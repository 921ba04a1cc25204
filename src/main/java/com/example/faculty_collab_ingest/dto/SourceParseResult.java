package com.example.faculty_collab_ingest.dto;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个 .bib 文件的解析结果
 */
@Data
public class SourceParseResult {
    private Path file;
    private String sourcePid;
    private List<ParsedPublication> publications = new ArrayList<>();
    private int entriesParsed;
    private int parseErrors;
    private int duplicates;
    private List<String> errorMessages = new ArrayList<>();
}
