package com.example.faculty_collab_ingest.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SourceFileNamingTest {

    @Test
    public void testFileNameForPid() {
        assertEquals("01_1744-1.bib", SourceFileNaming.fileNameFor("01/1744-1"));
        assertEquals("s_SatishNarayanaSrirama.bib", SourceFileNaming.fileNameFor("s/SatishNarayanaSrirama"));
    }

    @Test
    public void testCandidateStemsStripNameSuffixAndDuplicateMarker() {
        assertEquals(List.of("01_1744-1_alok", "01_1744-1"), SourceFileNaming.candidateStems("01_1744-1_alok"));
        assertEquals(List.of("94_4013_1", "94_4013"), SourceFileNaming.candidateStems("94_4013_1"));
        assertEquals(List.of("94_4013"), SourceFileNaming.candidateStems("94_4013"));
    }

    @Test
    public void testFallbackPid() {
        assertEquals("94/4013", SourceFileNaming.fallbackPid("94_4013_2"));
        assertEquals("01/1744-1", SourceFileNaming.fallbackPid("01_1744-1_alok"));
    }
}
