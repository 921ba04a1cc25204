package com.example.faculty_collab_ingest.service.impl;

import com.example.faculty_collab_ingest.client.DblpClient;
import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.FacultyVerification;
import com.example.faculty_collab_ingest.dto.VerificationReport;
import com.example.faculty_collab_ingest.dto.VerificationStatus;
import com.example.faculty_collab_ingest.exception.DblpClientException;
import com.example.faculty_collab_ingest.mapper.PublicationSourceMapper;
import com.example.faculty_collab_ingest.parser.BibtexParser;
import com.example.faculty_collab_ingest.service.FacultyRosterLoader;
import com.example.faculty_collab_ingest.service.PublicationVerificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class PublicationVerificationServiceImpl implements PublicationVerificationService {

    @Autowired
    private FacultyRosterLoader facultyRosterLoader;

    @Autowired
    private PublicationSourceMapper publicationSourceMapper;

    @Autowired
    private DblpClient dblpClient;

    @Value("${ingest.dblp.request-delay-ms:1000}")
    private long requestDelayMs;

    private final BibtexParser bibtexParser = new BibtexParser();

    @Override
    public VerificationReport verifyAll(Path rosterPath) throws IOException {
        return verifyAll(facultyRosterLoader.load(rosterPath));
    }

    @Override
    public VerificationReport verifyAll(FacultyRoster roster) {
        VerificationReport report = new VerificationReport();
        List<FacultyMember> members = roster.getMembers();
        for (int i = 0; i < members.size(); i++) {
            if (i > 0 && !pause()) {
                log.warn("核对被中断，已完成 {}/{}", i, members.size());
                break;
            }
            report.getResults().add(verify(members.get(i)));
        }
        log.info("核对完成: 匹配 {}，不匹配 {}，出错 {}，匹配率 {}",
                report.count(VerificationStatus.MATCH), report.count(VerificationStatus.MISMATCH),
                report.count(VerificationStatus.ERROR), String.format("%.2f%%", report.getMatchRate() * 100));
        for (FacultyVerification mismatch : report.getMismatches()) {
            log.info("不匹配: {} 库中 {}，DBLP {}", mismatch.getFacultyName(),
                    mismatch.getStoredCount(), mismatch.getLiveCount());
        }
        return report;
    }

    @Override
    public FacultyVerification verify(FacultyMember member) {
        FacultyVerification result = new FacultyVerification();
        result.setFacultyName(member.getName());
        result.setPids(member.getPids());
        try {
            result.setStoredCount(publicationSourceMapper.countPublicationsBySourcePids(member.getPids()));
            // 多个 PID 的书目可能重叠，按条目键取并集
            Set<String> liveKeys = new HashSet<>();
            for (String pid : member.getPids()) {
                liveKeys.addAll(bibtexParser.parse(dblpClient.fetchBibliography(pid)).distinctKeys());
            }
            result.setLiveCount((long) liveKeys.size());
            result.setStatus(liveKeys.size() == result.getStoredCount()
                    ? VerificationStatus.MATCH : VerificationStatus.MISMATCH);
        } catch (DblpClientException e) {
            log.warn("无法获取 {} 的 DBLP 书目: {}", member.getName(), e.getMessage());
            result.setStatus(VerificationStatus.ERROR);
            result.setMessage(e.getMessage());
        } catch (DataAccessException e) {
            log.warn("查询 {} 的库中论文数失败: {}", member.getName(), e.getMessage());
            result.setStatus(VerificationStatus.ERROR);
            result.setMessage("Stored count query failed: " + e.getMessage());
        }
        return result;
    }

    private boolean pause() {
        if (requestDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(requestDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
