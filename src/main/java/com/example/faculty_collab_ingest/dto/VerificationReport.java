package com.example.faculty_collab_ingest.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 核对报告。匹配率 = 匹配数 / (匹配数 + 不匹配数)，出错的教师单独列出不计入分母
 */
@Data
public class VerificationReport {
    private List<FacultyVerification> results = new ArrayList<>();

    public long count(VerificationStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public double getMatchRate() {
        long matched = count(VerificationStatus.MATCH);
        long compared = matched + count(VerificationStatus.MISMATCH);
        return compared == 0 ? 0.0 : (double) matched / compared;
    }

    public List<FacultyVerification> getMismatches() {
        return filter(VerificationStatus.MISMATCH);
    }

    public List<FacultyVerification> getErrors() {
        return filter(VerificationStatus.ERROR);
    }

    private List<FacultyVerification> filter(VerificationStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).collect(Collectors.toList());
    }
}
