package com.example.faculty_collab_ingest.service;

import com.example.faculty_collab_ingest.dto.BatchResult;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.IngestionStats;
import com.example.faculty_collab_ingest.dto.ParsedPublication;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 论文导入服务：按文件名顺序处理来源目录下的 .bib 文件，分批提交。
 */
public interface PublicationIngestionService {

    /**
     * 加载教师名单并导入整个目录
     */
    IngestionStats ingestDirectory(Path sourceDir, Path rosterPath) throws IOException;

    /**
     * 使用已加载的名单导入整个目录
     */
    IngestionStats ingestSources(Path sourceDir, FacultyRoster roster) throws IOException;

    /**
     * 在一个事务中提交一批记录；出现非致命错误时回滚并逐条重试
     */
    BatchResult ingestBatch(List<ParsedPublication> records, FacultyRoster roster);

    /**
     * 重新计算教师作者的论文数和合作者数
     */
    void refreshFacultyStatistics();
}
