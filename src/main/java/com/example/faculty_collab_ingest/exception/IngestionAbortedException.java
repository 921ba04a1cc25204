package com.example.faculty_collab_ingest.exception;

import com.example.faculty_collab_ingest.dto.IngestionStats;

/**
 * 数据库连接丢失等致命错误导致导入中止，携带中止前已提交部分的统计
 */
public class IngestionAbortedException extends RuntimeException {

    private final IngestionStats stats;

    public IngestionAbortedException(String message, IngestionStats stats, Throwable cause) {
        super(message, cause);
        this.stats = stats;
    }

    public IngestionStats getStats() {
        return stats;
    }
}
