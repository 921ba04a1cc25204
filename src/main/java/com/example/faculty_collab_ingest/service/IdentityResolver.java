package com.example.faculty_collab_ingest.service;

import com.example.faculty_collab_ingest.dto.AuthorClassification;
import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 判断论文署名作者是否为被跟踪的教师。
 * 只在论文来源 PID 集合对应的教师中查找，不做模糊匹配。
 */
public interface IdentityResolver {

    Optional<FacultyMember> resolve(Collection<String> sourcePids, String authorName, FacultyRoster roster);

    List<AuthorClassification> classify(Collection<String> sourcePids, List<String> authorNames, FacultyRoster roster);
}
