package com.example.faculty_collab_ingest.dto;

import lombok.Data;

import java.util.List;

/**
 * 单个教师的核对结果
 */
@Data
public class FacultyVerification {
    private String facultyName;
    private List<String> pids;
    private long storedCount;
    private Long liveCount;
    private VerificationStatus status;
    private String message;

    public Long getDifference() {
        return liveCount == null ? null : liveCount - storedCount;
    }
}
