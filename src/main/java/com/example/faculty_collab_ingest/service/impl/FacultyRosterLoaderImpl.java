package com.example.faculty_collab_ingest.service.impl;

import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.FacultyRosterEntry;
import com.example.faculty_collab_ingest.service.FacultyRosterLoader;
import com.example.faculty_collab_ingest.util.NameNormalizer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 从 JSON 文件加载教师名单，只保留已匹配且至少有一个 PID 的教师
 */
@Slf4j
@Service
public class FacultyRosterLoaderImpl implements FacultyRosterLoader {

    @Autowired
    private ObjectMapper objectMapper;

    @Override
    public FacultyRoster load(Path rosterPath) throws IOException {
        try (InputStream in = Files.newInputStream(rosterPath)) {
            FacultyRoster roster = load(in);
            log.info("已从 {} 加载教师名单: {} 位教师，{} 个 PID", rosterPath, roster.size(), roster.pidCount());
            return roster;
        }
    }

    @Override
    public FacultyRoster load(InputStream in) throws IOException {
        List<FacultyRosterEntry> entries = objectMapper.readValue(in, new TypeReference<List<FacultyRosterEntry>>() {});
        List<FacultyMember> members = new ArrayList<>();
        for (FacultyRosterEntry entry : entries) {
            if (entry == null || !entry.isDblpMatched()) {
                continue;
            }
            if (entry.getFacultyName() == null || entry.getFacultyName().isBlank()) {
                log.warn("跳过没有姓名的名单条目: pid={}", entry.getDblpPid());
                continue;
            }
            Set<String> pids = new LinkedHashSet<>();
            addPid(pids, entry.getDblpPid());
            if (entry.getAllMatches() != null) {
                for (FacultyRosterEntry.Match match : entry.getAllMatches()) {
                    if (match != null) {
                        addPid(pids, match.getDblpPid());
                    }
                }
            }
            if (pids.isEmpty()) {
                log.warn("教师 {} 标记为已匹配但没有 PID，跳过", entry.getFacultyName());
                continue;
            }
            String name = entry.getFacultyName().trim();
            members.add(new FacultyMember(name, NameNormalizer.normalize(name), List.copyOf(pids),
                    blankToNull(entry.getEmail()), blankToNull(entry.getPhone()),
                    blankToNull(entry.getDesignation()), blankToNull(entry.getDepartment()),
                    entry.getHindex()));
        }
        return new FacultyRoster(members);
    }

    private static void addPid(Set<String> pids, String pid) {
        if (pid != null && !pid.isBlank()) {
            pids.add(pid.trim());
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
