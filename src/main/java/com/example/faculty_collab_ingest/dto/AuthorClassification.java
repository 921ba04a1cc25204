package com.example.faculty_collab_ingest.dto;

import lombok.Value;

/**
 * 一位署名作者的身份判定结果；faculty 为 false 时 member 为 null
 */
@Value
public class AuthorClassification {
    String authorName;
    String normalizedName;
    int position;
    FacultyMember member;

    public boolean isFaculty() {
        return member != null;
    }
}
