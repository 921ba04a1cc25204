package com.example.faculty_collab_ingest.service;

import com.example.faculty_collab_ingest.dto.FacultyRoster;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * 教师名单加载服务
 */
public interface FacultyRosterLoader {

    FacultyRoster load(Path rosterPath) throws IOException;

    FacultyRoster load(InputStream in) throws IOException;
}
