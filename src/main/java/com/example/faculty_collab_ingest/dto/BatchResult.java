package com.example.faculty_collab_ingest.dto;

import lombok.Value;

import java.util.List;

/**
 * 一个批次的提交结果：提交的记录数、失败记录以及已提交部分的统计
 */
@Value
public class BatchResult {
    int committed;
    List<IngestionError> failures;
    IngestionStats stats;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
