package com.example.faculty_collab_ingest.service;

import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.IngestionStats;
import com.example.faculty_collab_ingest.dto.ParsedPublication;

/**
 * 单条论文记录的幂等入库：论文、来源、作者、署名关系、合作关系和期刊统计。
 * 调用方负责事务边界。
 */
public interface PublicationUpsertService {

    void upsert(ParsedPublication record, FacultyRoster roster, IngestionStats stats);
}
