package com.example.faculty_collab_ingest.service.impl;

import com.example.faculty_collab_ingest.dto.FacultyMember;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FacultyRosterLoaderImplTest {

    private FacultyRosterLoaderImpl loader;

    @BeforeEach
    public void setUp() {
        loader = new FacultyRosterLoaderImpl();
        ReflectionTestUtils.setField(loader, "objectMapper", new ObjectMapper());
    }

    @Test
    public void testLoadKeepsOnlyMatchedMembersWithPids() throws IOException {
        FacultyRoster roster;
        try (InputStream in = getClass().getResourceAsStream("/roster/faculty_roster.json")) {
            roster = loader.load(in);
        }

        assertEquals(3, roster.size());
        assertEquals(4, roster.pidCount());

        FacultyMember alok = roster.findByPid("01/1744-2").orElseThrow();
        assertEquals("Alok Singh", alok.getName());
        assertEquals("alok singh", alok.getNormalizedName());
        assertEquals(List.of("01/1744-1", "01/1744-2"), alok.getPids());
        assertEquals("01/1744-1", alok.getPrimaryPid());
        assertEquals("alok@uohyd.ac.in", alok.getEmail());
        assertNull(alok.getPhone());
        assertEquals(Integer.valueOf(25), alok.getHindex());

        FacultyMember rajeev = roster.findByPid("w/RajeevWankar").orElseThrow();
        assertEquals("rajeev wankar", rajeev.getNormalizedName());

        assertEquals("s/SatishNarayanaSrirama", roster.findPidBySanitized("s_SatishNarayanaSrirama").orElseThrow());
        assertFalse(roster.findByPid(null).isPresent());
        assertTrue(roster.getMembers().stream().noneMatch(m -> m.getName().startsWith("Unmatched")));
    }

    @Test
    public void testLoadEmptyArray() throws IOException {
        FacultyRoster roster = loader.load(new ByteArrayInputStream("[]".getBytes(StandardCharsets.UTF_8)));

        assertEquals(0, roster.size());
        assertFalse(roster.containsPid("01/1744-1"));
    }
}
