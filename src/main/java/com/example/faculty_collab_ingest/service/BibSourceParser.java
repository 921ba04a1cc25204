package com.example.faculty_collab_ingest.service;

import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.SourceParseResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * .bib 来源文件解析服务
 */
public interface BibSourceParser {

    /**
     * 解析单个文件，文件内按键和 DOI 去重，保留第一次出现的记录
     */
    SourceParseResult parseFile(Path file, String sourcePid) throws IOException;

    /**
     * 解析文本内容，sourceName 仅用于日志
     */
    SourceParseResult parse(String content, String sourcePid, String sourceName);

    /**
     * 根据文件名推断来源教师的 PID
     */
    String resolveSourcePid(Path file, FacultyRoster roster);
}
