package com.example.faculty_collab_ingest.dto;

import com.example.faculty_collab_ingest.util.SourceFileNaming;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 不可变的教师名单，一次运行只加载一次，显式传给身份解析器
 */
public final class FacultyRoster {

    private final List<FacultyMember> members;
    private final Map<String, FacultyMember> byPid;
    private final Map<String, String> pidBySanitized;

    public FacultyRoster(List<FacultyMember> members) {
        this.members = List.copyOf(members);
        Map<String, FacultyMember> pidIndex = new LinkedHashMap<>();
        Map<String, String> sanitizedIndex = new LinkedHashMap<>();
        for (FacultyMember member : this.members) {
            for (String pid : member.getPids()) {
                pidIndex.putIfAbsent(pid, member);
                sanitizedIndex.putIfAbsent(SourceFileNaming.sanitizePid(pid), pid);
            }
        }
        this.byPid = Collections.unmodifiableMap(pidIndex);
        this.pidBySanitized = Collections.unmodifiableMap(sanitizedIndex);
    }

    public static FacultyRoster empty() {
        return new FacultyRoster(List.of());
    }

    public List<FacultyMember> getMembers() {
        return members;
    }

    public Optional<FacultyMember> findByPid(String pid) {
        return Optional.ofNullable(pid == null ? null : byPid.get(pid));
    }

    public boolean containsPid(String pid) {
        return pid != null && byPid.containsKey(pid);
    }

    public boolean containsAnyPid(Collection<String> pids) {
        return pids.stream().anyMatch(this::containsPid);
    }

    /**
     * 由文件名主干反查 PID
     */
    public Optional<String> findPidBySanitized(String sanitized) {
        return Optional.ofNullable(pidBySanitized.get(sanitized));
    }

    public int size() {
        return members.size();
    }

    public int pidCount() {
        return byPid.size();
    }
}
