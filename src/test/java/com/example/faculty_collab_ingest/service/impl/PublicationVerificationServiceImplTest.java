package com.example.faculty_collab_ingest.service.impl;

import com.example.faculty_collab_ingest.client.DblpClient;
import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.FacultyVerification;
import com.example.faculty_collab_ingest.dto.VerificationReport;
import com.example.faculty_collab_ingest.dto.VerificationStatus;
import com.example.faculty_collab_ingest.mapper.PublicationSourceMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 库中计数查询失败时只影响当前教师
 */
@ExtendWith(MockitoExtension.class)
public class PublicationVerificationServiceImplTest {

    @Mock
    private PublicationSourceMapper publicationSourceMapper;

    @Mock
    private DblpClient dblpClient;

    @InjectMocks
    private PublicationVerificationServiceImpl publicationVerificationService;

    @Test
    public void testStoredCountFailureBecomesErrorRow() {
        FacultyMember broken = member("Alok Singh", "01/1744-1");
        FacultyMember healthy = member("Rajeev Wankar", "w/RajeevWankar");
        when(publicationSourceMapper.countPublicationsBySourcePids(broken.getPids()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));
        when(publicationSourceMapper.countPublicationsBySourcePids(healthy.getPids())).thenReturn(1L);
        when(dblpClient.fetchBibliography("w/RajeevWankar")).thenReturn("@article{K300, title = {Grid}}\n");

        VerificationReport report = publicationVerificationService.verifyAll(new FacultyRoster(List.of(broken, healthy)));

        assertEquals(2, report.getResults().size());
        FacultyVerification first = report.getResults().get(0);
        assertEquals(VerificationStatus.ERROR, first.getStatus());
        assertTrue(first.getMessage().contains("connection reset"));
        assertNull(first.getLiveCount());
        assertEquals(VerificationStatus.MATCH, report.getResults().get(1).getStatus());
        verify(dblpClient, never()).fetchBibliography("01/1744-1");
    }

    private static FacultyMember member(String name, String pid) {
        return new FacultyMember(name, name.toLowerCase(), List.of(pid), null, null, null, null, null);
    }
}
