package com.example.faculty_collab_ingest.dto;

import lombok.Value;

import java.util.List;

/**
 * 名单中被跟踪的一位教师，pids 中第一个为主 PID
 */
@Value
public class FacultyMember {
    String name;
    String normalizedName;
    List<String> pids;
    String email;
    String phone;
    String designation;
    String department;
    Integer hindex;

    public String getPrimaryPid() {
        return pids.get(0);
    }
}
