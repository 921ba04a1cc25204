package com.example.faculty_collab_ingest.service;

import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.FetchResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 从 DBLP 下载每个 PID 的 .bib 文件到来源目录
 */
public interface BibSourceFetchService {

    FetchResult fetchAll(Path targetDir, Path rosterPath) throws IOException;

    FetchResult fetchAll(Path targetDir, FacultyRoster roster) throws IOException;
}
