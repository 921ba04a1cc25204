package com.example.faculty_collab_ingest.service;

import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.FacultyVerification;
import com.example.faculty_collab_ingest.dto.VerificationReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 将库中每位教师的论文数与 DBLP 实时书目核对，只读，不修正数据
 */
public interface PublicationVerificationService {

    VerificationReport verifyAll(Path rosterPath) throws IOException;

    VerificationReport verifyAll(FacultyRoster roster);

    FacultyVerification verify(FacultyMember member);
}
