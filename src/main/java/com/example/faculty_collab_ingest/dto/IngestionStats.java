package com.example.faculty_collab_ingest.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次导入运行的统计信息
 */
@Data
public class IngestionStats {
    private int filesProcessed;
    private int filesFailed;
    private int entriesParsed;
    private int parseErrors;
    private int duplicatesInSource;
    private int publicationsAdded;
    // 已存在的论文（包括跨文件合并的记录）
    private int publicationsSkipped;
    private int sourceLinksAdded;
    private int authorsAdded;
    private int authorsUpgraded;
    private int venuesAdded;
    private int collaborationsAdded;
    // 入库失败的记录；解析失败的条目只计入 parseErrors
    private List<IngestionError> errors = new ArrayList<>();

    public void merge(IngestionStats other) {
        filesProcessed += other.filesProcessed;
        filesFailed += other.filesFailed;
        entriesParsed += other.entriesParsed;
        parseErrors += other.parseErrors;
        duplicatesInSource += other.duplicatesInSource;
        publicationsAdded += other.publicationsAdded;
        publicationsSkipped += other.publicationsSkipped;
        sourceLinksAdded += other.sourceLinksAdded;
        authorsAdded += other.authorsAdded;
        authorsUpgraded += other.authorsUpgraded;
        venuesAdded += other.venuesAdded;
        collaborationsAdded += other.collaborationsAdded;
        errors.addAll(other.errors);
    }

    public void addError(String sourcePid, String dblpKey, String message) {
        errors.add(new IngestionError(sourcePid, dblpKey, message));
    }

    /**
     * 出错总数：解析失败的条目加上入库失败的记录
     */
    public int getErrorCount() {
        return parseErrors + errors.size();
    }

    public String summary() {
        return String.format("files=%d (failed %d), entries=%d, parseErrors=%d, duplicates=%d, "
                        + "publications added=%d skipped=%d, sourceLinks=%d, authors added=%d upgraded=%d, "
                        + "venues=%d, collaborations=%d, errors=%d (parse %d, records %d)",
                filesProcessed, filesFailed, entriesParsed, parseErrors, duplicatesInSource,
                publicationsAdded, publicationsSkipped, sourceLinksAdded, authorsAdded, authorsUpgraded,
                venuesAdded, collaborationsAdded, getErrorCount(), parseErrors, errors.size());
    }
}
