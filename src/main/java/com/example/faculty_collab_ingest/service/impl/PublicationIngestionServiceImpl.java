package com.example.faculty_collab_ingest.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.UpdateWrapper;
import com.example.faculty_collab_ingest.dto.BatchResult;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.IngestionError;
import com.example.faculty_collab_ingest.dto.IngestionStats;
import com.example.faculty_collab_ingest.dto.ParsedPublication;
import com.example.faculty_collab_ingest.dto.SourceParseResult;
import com.example.faculty_collab_ingest.exception.IngestionAbortedException;
import com.example.faculty_collab_ingest.mapper.AuthorMapper;
import com.example.faculty_collab_ingest.mapper.CollaborationMapper;
import com.example.faculty_collab_ingest.mapper.DataSourceMapper;
import com.example.faculty_collab_ingest.mapper.PublicationAuthorMapper;
import com.example.faculty_collab_ingest.mapper.PublicationMapper;
import com.example.faculty_collab_ingest.model.Author;
import com.example.faculty_collab_ingest.model.DataSource;
import com.example.faculty_collab_ingest.service.BibSourceParser;
import com.example.faculty_collab_ingest.service.FacultyRosterLoader;
import com.example.faculty_collab_ingest.service.PublicationIngestionService;
import com.example.faculty_collab_ingest.service.PublicationUpsertService;
import com.example.faculty_collab_ingest.util.SourceFileNaming;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
public class PublicationIngestionServiceImpl implements PublicationIngestionService {

    @Autowired
    private BibSourceParser bibSourceParser;

    @Autowired
    private FacultyRosterLoader facultyRosterLoader;

    @Autowired
    private PublicationUpsertService publicationUpsertService;

    @Autowired
    private PublicationMapper publicationMapper;

    @Autowired
    private PublicationAuthorMapper publicationAuthorMapper;

    @Autowired
    private AuthorMapper authorMapper;

    @Autowired
    private CollaborationMapper collaborationMapper;

    @Autowired
    private DataSourceMapper dataSourceMapper;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Value("${ingest.batch-size:100}")
    private int batchSize;

    @Value("${ingest.source-name:DBLP}")
    private String sourceName;

    @Override
    public IngestionStats ingestDirectory(Path sourceDir, Path rosterPath) throws IOException {
        FacultyRoster roster = facultyRosterLoader.load(rosterPath);
        return ingestSources(sourceDir, roster);
    }

    @Override
    public IngestionStats ingestSources(Path sourceDir, FacultyRoster roster) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(sourceDir)) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(SourceFileNaming.BIB_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }
        log.info("在 {} 中找到 {} 个 .bib 文件，批大小 {}", sourceDir, files.size(), batchSize);

        IngestionStats stats = new IngestionStats();
        try {
            for (Path file : files) {
                ingestFile(file, roster, stats);
            }
            refreshFacultyStatistics();
            updateDataSource(DataSource.STATUS_ACTIVE, null);
        } catch (DataAccessResourceFailureException e) {
            log.error("数据库连接丢失，导入中止: {}", e.getMessage());
            markDataSourceFailed(e);
            throw new IngestionAbortedException("Ingestion aborted: " + e.getMessage(), stats, e);
        }
        log.info("导入完成: {}", stats.summary());
        return stats;
    }

    private void ingestFile(Path file, FacultyRoster roster, IngestionStats stats) {
        String sourcePid = bibSourceParser.resolveSourcePid(file, roster);
        SourceParseResult parsed;
        try {
            parsed = bibSourceParser.parseFile(file, sourcePid);
        } catch (IOException e) {
            log.error("读取文件 {} 失败: {}", file, e.getMessage());
            stats.setFilesFailed(stats.getFilesFailed() + 1);
            stats.addError(sourcePid, null, "Cannot read " + file.getFileName() + ": " + e.getMessage());
            return;
        }
        stats.setFilesProcessed(stats.getFilesProcessed() + 1);
        stats.setEntriesParsed(stats.getEntriesParsed() + parsed.getEntriesParsed());
        stats.setParseErrors(stats.getParseErrors() + parsed.getParseErrors());
        stats.setDuplicatesInSource(stats.getDuplicatesInSource() + parsed.getDuplicates());

        List<ParsedPublication> records = parsed.getPublications();
        for (int from = 0; from < records.size(); from += batchSize) {
            List<ParsedPublication> batch = records.subList(from, Math.min(from + batchSize, records.size()));
            BatchResult result = ingestBatch(batch, roster);
            stats.merge(result.getStats());
            if (result.hasFailures()) {
                log.warn("{} 的批次 [{}, {}) 有 {} 条记录失败", file.getFileName(), from,
                        from + batch.size(), result.getFailures().size());
            }
        }
    }

    @Override
    public BatchResult ingestBatch(List<ParsedPublication> records, FacultyRoster roster) {
        try {
            IngestionStats committed = transactionTemplate.execute(status -> {
                IngestionStats batchStats = new IngestionStats();
                for (ParsedPublication record : records) {
                    publicationUpsertService.upsert(record, roster, batchStats);
                }
                return batchStats;
            });
            return new BatchResult(records.size(), List.of(), committed);
        } catch (DataAccessResourceFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("批次提交失败，已回滚，改为逐条提交: {}", e.getMessage());
        }

        // 逐条重试，只有出错的记录被丢弃
        IngestionStats stats = new IngestionStats();
        List<IngestionError> failures = new ArrayList<>();
        int committed = 0;
        for (ParsedPublication record : records) {
            try {
                IngestionStats recordStats = transactionTemplate.execute(status -> {
                    IngestionStats single = new IngestionStats();
                    publicationUpsertService.upsert(record, roster, single);
                    return single;
                });
                stats.merge(recordStats);
                committed++;
            } catch (DataAccessResourceFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("论文 {} (来源 {}) 入库失败: {}", record.getDblpKey(), record.getSourcePid(), e.getMessage());
                IngestionError error = new IngestionError(record.getSourcePid(), record.getDblpKey(), e.getMessage());
                failures.add(error);
                stats.getErrors().add(error);
            }
        }
        return new BatchResult(committed, failures, stats);
    }

    @Override
    public void refreshFacultyStatistics() {
        Map<Long, Long> publicationCounts = new HashMap<>();
        for (Map<String, Object> row : publicationAuthorMapper.selectFacultyPublicationCounts()) {
            Long authorId = ((Number) row.get("authorId")).longValue();
            publicationCounts.put(authorId, ((Number) row.get("cnt")).longValue());
        }
        List<Author> faculty = authorMapper.selectList(new QueryWrapper<Author>().eq("is_faculty", true));
        transactionTemplate.executeWithoutResult(status -> {
            for (Author author : faculty) {
                Author update = new Author();
                update.setId(author.getId());
                update.setTotalPublications(publicationCounts.getOrDefault(author.getId(), 0L).intValue());
                update.setTotalCollaborations((int) collaborationMapper.countByAuthor(author.getId()));
                update.setUpdatedAt(LocalDateTime.now());
                authorMapper.updateById(update);
            }
        });
        log.info("已刷新 {} 位教师的统计信息", faculty.size());
    }

    private void updateDataSource(String status, String errorMessage) {
        DataSource source = dataSourceMapper.selectOne(new QueryWrapper<DataSource>().eq("source_name", sourceName));
        boolean exists = source != null;
        if (!exists) {
            source = new DataSource();
            source.setSourceName(sourceName);
        }
        source.setLastSync(LocalDateTime.now());
        source.setTotalRecords(Math.toIntExact(publicationMapper.selectCount(null)));
        source.setStatus(status);
        source.setUpdatedAt(LocalDateTime.now());
        if (exists) {
            source.setErrorMessage(null);
            // error_message 需要能被清空，显式 set
            dataSourceMapper.update(source, new UpdateWrapper<DataSource>()
                    .eq("id", source.getId())
                    .set("error_message", errorMessage));
        } else {
            source.setErrorMessage(errorMessage);
            dataSourceMapper.insert(source);
        }
    }

    private void markDataSourceFailed(RuntimeException cause) {
        try {
            updateDataSource(DataSource.STATUS_ERROR, cause.getMessage());
        } catch (RuntimeException e) {
            log.warn("无法更新数据源状态: {}", e.getMessage());
        }
    }
}
