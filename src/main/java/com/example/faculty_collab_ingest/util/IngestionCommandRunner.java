package com.example.faculty_collab_ingest.util;

import com.example.faculty_collab_ingest.dto.FacultyVerification;
import com.example.faculty_collab_ingest.dto.FetchResult;
import com.example.faculty_collab_ingest.dto.IngestionError;
import com.example.faculty_collab_ingest.dto.IngestionStats;
import com.example.faculty_collab_ingest.dto.VerificationReport;
import com.example.faculty_collab_ingest.service.BibSourceFetchService;
import com.example.faculty_collab_ingest.service.PublicationIngestionService;
import com.example.faculty_collab_ingest.service.PublicationVerificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 命令行入口：ingest 导入来源目录，verify 与 DBLP 核对，fetch 下载 .bib 文件。
 * 没有命令时只打印用法，不访问任何数据。
 */
@Slf4j
@Component
public class IngestionCommandRunner implements CommandLineRunner {

    private static final int MAX_LOGGED_ERRORS = 20;

    @Autowired
    private PublicationIngestionService publicationIngestionService;

    @Autowired
    private PublicationVerificationService publicationVerificationService;

    @Autowired
    private BibSourceFetchService bibSourceFetchService;

    @Value("${ingest.source-dir:dataset/dblp}")
    private String sourceDir;

    @Value("${ingest.roster-path:references/dblp/faculty_dblp_matched.json}")
    private String rosterPath;

    @Override
    public void run(String... args) throws Exception {
        // Spring 的 --key=value 参数不是命令
        List<String> commands = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .collect(Collectors.toList());
        if (commands.isEmpty()) {
            log.info("用法: faculty-collab-ingest <ingest|verify|fetch> [--ingest.source-dir=...] [--ingest.roster-path=...]");
            return;
        }
        Path sources = Paths.get(sourceDir);
        Path roster = Paths.get(rosterPath);
        switch (commands.get(0)) {
            case "ingest":
                IngestionStats stats = publicationIngestionService.ingestDirectory(sources, roster);
                logErrors(stats);
                break;
            case "verify":
                VerificationReport report = publicationVerificationService.verifyAll(roster);
                for (FacultyVerification error : report.getErrors()) {
                    log.warn("核对出错: {} {}", error.getFacultyName(), error.getMessage());
                }
                break;
            case "fetch":
                FetchResult result = bibSourceFetchService.fetchAll(sources, roster);
                result.getFailures().forEach((pid, message) -> log.warn("下载失败: {} {}", pid, message));
                break;
            default:
                log.error("未知命令: {}，可用命令为 ingest、verify、fetch", commands.get(0));
        }
    }

    private void logErrors(IngestionStats stats) {
        List<IngestionError> errors = stats.getErrors();
        errors.stream().limit(MAX_LOGGED_ERRORS).forEach(error ->
                log.warn("入库错误: 来源 {} 键 {}: {}", error.getSourcePid(), error.getDblpKey(), error.getMessage()));
        if (errors.size() > MAX_LOGGED_ERRORS) {
            log.warn("另有 {} 条错误未列出", errors.size() - MAX_LOGGED_ERRORS);
        }
    }
}
