package com.example.faculty_collab_ingest.dto;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 批量下载 .bib 文件的结果，failures 为 PID 到失败原因的映射
 */
@Data
public class FetchResult {
    private int downloaded;
    private Map<String, String> failures = new LinkedHashMap<>();
}
