package com.example.faculty_collab_ingest.service.impl;

import com.example.faculty_collab_ingest.dto.AuthorClassification;
import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.service.IdentityResolver;
import com.example.faculty_collab_ingest.util.NameNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 规范化姓名完全相等才判定为教师。
 * "Satish Srirama" 与 "Satish Narayana Srirama" 不会匹配，这是有意保留的限制。
 */
@Component
public class ExactNameIdentityResolver implements IdentityResolver {

    @Override
    public Optional<FacultyMember> resolve(Collection<String> sourcePids, String authorName, FacultyRoster roster) {
        if (authorName == null || sourcePids == null || sourcePids.isEmpty()) {
            return Optional.empty();
        }
        String normalized = NameNormalizer.normalize(authorName);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (String pid : sourcePids) {
            Optional<FacultyMember> member = roster.findByPid(pid);
            if (member.isPresent() && member.get().getNormalizedName().equals(normalized)) {
                return member;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<AuthorClassification> classify(Collection<String> sourcePids, List<String> authorNames,
                                               FacultyRoster roster) {
        List<AuthorClassification> result = new ArrayList<>(authorNames.size());
        for (int i = 0; i < authorNames.size(); i++) {
            String name = authorNames.get(i);
            FacultyMember member = resolve(sourcePids, name, roster).orElse(null);
            result.add(new AuthorClassification(name, NameNormalizer.normalize(name), i + 1, member));
        }
        return result;
    }
}
