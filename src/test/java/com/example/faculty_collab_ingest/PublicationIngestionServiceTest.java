package com.example.faculty_collab_ingest;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.example.faculty_collab_ingest.dto.BatchResult;
import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.IngestionStats;
import com.example.faculty_collab_ingest.dto.ParsedPublication;
import com.example.faculty_collab_ingest.mapper.AuthorMapper;
import com.example.faculty_collab_ingest.mapper.CollaborationMapper;
import com.example.faculty_collab_ingest.mapper.DataSourceMapper;
import com.example.faculty_collab_ingest.mapper.PublicationAuthorMapper;
import com.example.faculty_collab_ingest.mapper.PublicationMapper;
import com.example.faculty_collab_ingest.mapper.PublicationSourceMapper;
import com.example.faculty_collab_ingest.mapper.VenueMapper;
import com.example.faculty_collab_ingest.model.Author;
import com.example.faculty_collab_ingest.model.Collaboration;
import com.example.faculty_collab_ingest.model.DataSource;
import com.example.faculty_collab_ingest.model.Publication;
import com.example.faculty_collab_ingest.model.PublicationSource;
import com.example.faculty_collab_ingest.model.Venue;
import com.example.faculty_collab_ingest.service.FacultyRosterLoader;
import com.example.faculty_collab_ingest.service.PublicationIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 导入流程集成测试，使用 H2 内存库，批大小为 2
 */
@SpringBootTest
@ActiveProfiles("test")
public class PublicationIngestionServiceTest {

    @Autowired
    private PublicationIngestionService publicationIngestionService;

    @Autowired
    private FacultyRosterLoader facultyRosterLoader;

    @Autowired
    private PublicationMapper publicationMapper;

    @Autowired
    private PublicationSourceMapper publicationSourceMapper;

    @Autowired
    private PublicationAuthorMapper publicationAuthorMapper;

    @Autowired
    private AuthorMapper authorMapper;

    @Autowired
    private VenueMapper venueMapper;

    @Autowired
    private CollaborationMapper collaborationMapper;

    @Autowired
    private DataSourceMapper dataSourceMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @TempDir
    Path sourceDir;

    @BeforeEach
    public void setUp() {
        BibFixtures.clearDatabase(jdbcTemplate);
    }

    @Test
    public void testIngestMergesSharedPublicationAcrossFacultyFiles() throws Exception {
        BibFixtures.writeAll(sourceDir);

        IngestionStats stats = publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        assertEquals(3, stats.getFilesProcessed());
        assertEquals(5, stats.getEntriesParsed());
        assertEquals(4, stats.getPublicationsAdded());
        assertEquals(1, stats.getPublicationsSkipped());
        assertEquals(5, stats.getSourceLinksAdded());
        assertEquals(5, stats.getAuthorsAdded());
        assertEquals(1, stats.getAuthorsUpgraded());
        assertEquals(2, stats.getVenuesAdded());
        assertEquals(5, stats.getCollaborationsAdded());
        assertEquals(0, stats.getErrorCount());

        assertEquals(Long.valueOf(4), publicationMapper.selectCount(null));
        Publication shared = findPublication("K123");
        assertEquals(Set.of("01/1744-1", "w/RajeevWankar"), sourcesOf(shared));
        assertEquals("01/1744-1", shared.getSourcePid());
        assertEquals(Integer.valueOf(3), shared.getAuthorCount());
        assertTrue(shared.getHasFacultyAuthor());

        Author alok = findAuthor("alok singh");
        assertTrue(alok.isFacultyMember());
        assertEquals("01/1744-1", alok.getDblpPid());
        assertEquals("alok@uohyd.ac.in", alok.getEmail());
        assertEquals(Integer.valueOf(25), alok.getHindex());
        assertEquals(Integer.valueOf(2), alok.getTotalPublications());
        assertEquals(Integer.valueOf(2), alok.getTotalCollaborations());

        // 在 Alok 的文件中首次出现时不是教师，合并 Rajeev 的来源后升级
        Author rajeev = findAuthor("rajeev wankar");
        assertTrue(rajeev.isFacultyMember());
        assertEquals("w/RajeevWankar", rajeev.getDblpPid());
        assertEquals(Integer.valueOf(14), rajeev.getHindex());
        assertEquals(Integer.valueOf(2), rajeev.getTotalPublications());
        assertEquals(Integer.valueOf(3), rajeev.getTotalCollaborations());

        Author jane = findAuthor("jane doe");
        assertFalse(jane.isFacultyMember());
        assertNull(jane.getDblpPid());
        assertNull(jane.getEmail());
        assertNull(jane.getTotalPublications());

        Venue journal = venueMapper.selectOne(new QueryWrapper<Venue>().eq("normalized_name", "j. par. comp."));
        assertEquals(Venue.TYPE_JOURNAL, journal.getVenueType());
        assertEquals(Integer.valueOf(3), journal.getTotalPublications());
        assertEquals(Integer.valueOf(3), journal.getFacultyPublications());
        Venue conference = venueMapper.selectOne(new QueryWrapper<Venue>().eq("normalized_name", "hipc"));
        assertEquals(Venue.TYPE_CONFERENCE, conference.getVenueType());
        assertEquals(Integer.valueOf(1), conference.getTotalPublications());

        DataSource source = dataSourceMapper.selectOne(new QueryWrapper<DataSource>().eq("source_name", "DBLP"));
        assertEquals(DataSource.STATUS_ACTIVE, source.getStatus());
        assertEquals(Integer.valueOf(4), source.getTotalRecords());
        assertNotNull(source.getLastSync());
    }

    @Test
    public void testFacultyAttributionDoesNotLeakAcrossSources() throws Exception {
        BibFixtures.writeAll(sourceDir);

        publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        // 与名单姓名完全一致，但 K300 只来自 Rajeev 的文件
        assertFalse(findAuthor("satish srirama").isFacultyMember());
        assertNull(findAuthor("satish srirama").getDblpPid());
        // 来自本人文件，但 DBLP 姓名带中间名，精确匹配不成立
        assertFalse(findAuthor("satish narayana srirama").isFacultyMember());
        assertEquals(Set.of("s/SatishNarayanaSrirama"), sourcesOf(findPublication("K400")));
    }

    @Test
    public void testShorterNameInOwnFileIsNotFaculty() throws Exception {
        String json = "[{\"faculty_name\": \"Satish Narayana Srirama\", "
                + "\"dblp_pid\": \"s/SatishNarayanaSrirama\", \"dblp_matched\": true, \"all_matches\": []}]";
        FacultyRoster roster = facultyRosterLoader.load(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        BibFixtures.write(sourceDir, BibFixtures.SATISH_FILE,
                "@article{K410, author = {Satish Srirama and Jane Doe}, title = {Mobile cloud}, year = {2019}}\n");

        publicationIngestionService.ingestSources(sourceDir, roster);

        // 本人文件里的作者名缺少中间名，不能归为教师
        Author author = findAuthor("satish srirama");
        assertNotNull(author);
        assertFalse(author.isFacultyMember());
        assertFalse(findPublication("K410").getHasFacultyAuthor());
        assertEquals(Set.of("s/SatishNarayanaSrirama"), sourcesOf(findPublication("K410")));
    }

    @Test
    public void testParseErrorsCountTowardsErrorTotal() throws Exception {
        BibFixtures.write(sourceDir, BibFixtures.SATISH_FILE, BibFixtures.SATISH_BIB
                + "@article{, title = {No key}}\n");

        IngestionStats stats = publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        assertEquals(1, stats.getParseErrors());
        assertTrue(stats.getErrors().isEmpty());
        assertEquals(1, stats.getErrorCount());
        assertTrue(stats.summary().contains("errors=1 (parse 1, records 0)"));
        assertNotNull(findPublication("K400"));
    }

    @Test
    public void testCollaborationCountsEqualSharedPublications() throws Exception {
        BibFixtures.writeAll(sourceDir);

        publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        List<Collaboration> collaborations = collaborationMapper.selectList(null);
        assertEquals(5, collaborations.size());
        for (Collaboration c : collaborations) {
            assertTrue(c.getAuthor1Id() < c.getAuthor2Id());
            assertEquals(publicationAuthorMapper.countSharedPublications(c.getAuthor1Id(), c.getAuthor2Id()),
                    c.getCollaborationCount().longValue());
        }

        Long alokId = findAuthor("alok singh").getId();
        Long janeId = findAuthor("jane doe").getId();
        Collaboration alokJane = collaborationMapper.selectOne(new QueryWrapper<Collaboration>()
                .eq("author1_id", Math.min(alokId, janeId))
                .eq("author2_id", Math.max(alokId, janeId)));
        assertEquals(Integer.valueOf(2), alokJane.getCollaborationCount());
        assertEquals(Integer.valueOf(2018), alokJane.getFirstCollaborationYear());
        assertEquals(Integer.valueOf(2020), alokJane.getLastCollaborationYear());
    }

    @Test
    public void testReingestingSameSourcesChangesNothing() throws Exception {
        BibFixtures.writeAll(sourceDir);
        publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);
        List<Long> before = snapshot();

        IngestionStats second = publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        assertEquals(before, snapshot());
        assertEquals(0, second.getPublicationsAdded());
        assertEquals(5, second.getPublicationsSkipped());
        assertEquals(0, second.getSourceLinksAdded());
        assertEquals(0, second.getAuthorsAdded());
        assertEquals(0, second.getAuthorsUpgraded());
        assertEquals(0, second.getVenuesAdded());
        assertEquals(0, second.getCollaborationsAdded());
    }

    @Test
    public void testSourceSetOnlyGrows() throws Exception {
        BibFixtures.writeAll(sourceDir);
        publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        Files.delete(sourceDir.resolve(BibFixtures.RAJEEV_FILE));
        publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        assertEquals(Set.of("01/1744-1", "w/RajeevWankar"), sourcesOf(findPublication("K123")));
        assertNotNull(findPublication("K300"));
        assertTrue(findAuthor("rajeev wankar").isFacultyMember());
    }

    @Test
    public void testSameDoiUnderDifferentKeyMergesIntoExistingRecord() throws Exception {
        BibFixtures.write(sourceDir, BibFixtures.ALOK_FILE,
                "@article{K500, author = {Alok Singh}, title = {Original}, doi = {10.1/x}, year = {2021}}\n");
        BibFixtures.write(sourceDir, BibFixtures.RAJEEV_FILE,
                "@article{K501, author = {Rajeev Wankar}, title = {Renamed}, doi = {10.1/X}, year = {2021}}\n");

        IngestionStats stats = publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        assertEquals(1, stats.getPublicationsAdded());
        assertEquals(Long.valueOf(1), publicationMapper.selectCount(null));
        Publication merged = findPublication("K500");
        assertEquals("Original", merged.getTitle());
        assertEquals(Set.of("01/1744-1", "w/RajeevWankar"), sourcesOf(merged));
        assertEquals(Integer.valueOf(2), merged.getAuthorCount());
    }

    @Test
    public void testFailingRecordOnlyLosesItself() throws Exception {
        String longTitle = "x".repeat(2100);
        BibFixtures.write(sourceDir, BibFixtures.ALOK_FILE,
                "@article{G1, author = {Alok Singh and Jane Doe}, title = {Good one}, year = {2020}}\n"
                        + "@article{BAD, author = {Alok Singh}, title = {" + longTitle + "}, year = {2020}}\n"
                        + "@article{G2, author = {Alok Singh and Jane Doe}, title = {Good two}, year = {2021}}\n");

        IngestionStats stats = publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        assertEquals(1, stats.getErrorCount());
        assertEquals("BAD", stats.getErrors().get(0).getDblpKey());
        assertEquals("01/1744-1", stats.getErrors().get(0).getSourcePid());
        assertEquals(2, stats.getPublicationsAdded());
        assertNotNull(findPublication("G1"));
        assertNotNull(findPublication("G2"));
        assertNull(findPublication("BAD"));
        // 回滚的批次不能留下重复计数
        Long alokId = findAuthor("alok singh").getId();
        Long janeId = findAuthor("jane doe").getId();
        Collaboration collaboration = collaborationMapper.selectOne(new QueryWrapper<Collaboration>()
                .eq("author1_id", Math.min(alokId, janeId))
                .eq("author2_id", Math.max(alokId, janeId)));
        assertEquals(Integer.valueOf(2), collaboration.getCollaborationCount());
    }

    @Test
    public void testIngestBatchReportsCommittedAndFailedRecords() throws Exception {
        FacultyRoster roster = facultyRosterLoader.load(BibFixtures.ROSTER);

        BatchResult result = publicationIngestionService.ingestBatch(
                List.of(record("B1", "Fine"), record("B2", "y".repeat(2100)), record("B3", "Also fine")), roster);

        assertEquals(2, result.getCommitted());
        assertTrue(result.hasFailures());
        assertEquals("B2", result.getFailures().get(0).getDblpKey());
        assertEquals(2, result.getStats().getPublicationsAdded());
        assertEquals(Long.valueOf(2), publicationMapper.selectCount(null));
    }

    @Test
    public void testNonBibFilesAreIgnored() throws Exception {
        BibFixtures.write(sourceDir, "notes.txt", "@article{X1, title = {Not a source}}");
        BibFixtures.write(sourceDir, BibFixtures.SATISH_FILE, BibFixtures.SATISH_BIB);

        IngestionStats stats = publicationIngestionService.ingestDirectory(sourceDir, BibFixtures.ROSTER);

        assertEquals(1, stats.getFilesProcessed());
        assertNull(findPublication("X1"));
        assertNotNull(findPublication("K400"));
    }

    private ParsedPublication record(String key, String title) {
        ParsedPublication record = new ParsedPublication();
        record.setDblpKey(key);
        record.setSourcePid("01/1744-1");
        record.setTitle(title);
        record.setPublicationType("article");
        record.setYear(2023);
        record.setAuthors(List.of("Alok Singh"));
        return record;
    }

    private Publication findPublication(String key) {
        return publicationMapper.selectOne(new QueryWrapper<Publication>().eq("dblp_key", key));
    }

    private Author findAuthor(String normalizedName) {
        return authorMapper.selectOne(new QueryWrapper<Author>().eq("normalized_name", normalizedName));
    }

    private Set<String> sourcesOf(Publication publication) {
        return publicationSourceMapper.selectList(new QueryWrapper<PublicationSource>()
                        .eq("publication_id", publication.getId()))
                .stream()
                .map(PublicationSource::getSourcePid)
                .collect(Collectors.toSet());
    }

    private List<Long> snapshot() {
        long collaborationTotal = collaborationMapper.selectList(null).stream()
                .mapToLong(Collaboration::getCollaborationCount).sum();
        long venueTotal = venueMapper.selectList(null).stream()
                .mapToLong(v -> v.getTotalPublications() + v.getFacultyPublications()).sum();
        long facultyAuthors = authorMapper.selectCount(new QueryWrapper<Author>().eq("is_faculty", true));
        return List.of(
                publicationMapper.selectCount(null),
                publicationSourceMapper.selectCount(null),
                publicationAuthorMapper.selectCount(null),
                authorMapper.selectCount(null),
                facultyAuthors,
                venueMapper.selectCount(null),
                collaborationMapper.selectCount(null),
                collaborationTotal,
                venueTotal);
    }
}
