package com.example.faculty_collab_ingest.service.impl;

import com.example.faculty_collab_ingest.client.DblpClient;
import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.FetchResult;
import com.example.faculty_collab_ingest.exception.DblpClientException;
import com.example.faculty_collab_ingest.service.BibSourceFetchService;
import com.example.faculty_collab_ingest.service.FacultyRosterLoader;
import com.example.faculty_collab_ingest.util.SourceFileNaming;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Service
public class BibSourceFetchServiceImpl implements BibSourceFetchService {

    @Autowired
    private FacultyRosterLoader facultyRosterLoader;

    @Autowired
    private DblpClient dblpClient;

    @Value("${ingest.dblp.request-delay-ms:1000}")
    private long requestDelayMs;

    @Override
    public FetchResult fetchAll(Path targetDir, Path rosterPath) throws IOException {
        return fetchAll(targetDir, facultyRosterLoader.load(rosterPath));
    }

    @Override
    public FetchResult fetchAll(Path targetDir, FacultyRoster roster) throws IOException {
        Files.createDirectories(targetDir);
        FetchResult result = new FetchResult();
        boolean first = true;
        for (FacultyMember member : roster.getMembers()) {
            for (String pid : member.getPids()) {
                if (!first) {
                    pause();
                }
                first = false;
                try {
                    String content = dblpClient.fetchBibliography(pid);
                    Path target = targetDir.resolve(SourceFileNaming.fileNameFor(pid));
                    Files.writeString(target, content, StandardCharsets.UTF_8);
                    result.setDownloaded(result.getDownloaded() + 1);
                    log.info("已下载 {} ({}) -> {}", member.getName(), pid, target.getFileName());
                } catch (DblpClientException e) {
                    log.warn("下载 {} ({}) 失败: {}", member.getName(), pid, e.getMessage());
                    result.getFailures().put(pid, e.getMessage());
                }
            }
        }
        log.info("下载完成: 成功 {}，失败 {}", result.getDownloaded(), result.getFailures().size());
        return result;
    }

    private void pause() throws IOException {
        if (requestDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(requestDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching bibliographies", e);
        }
    }
}
