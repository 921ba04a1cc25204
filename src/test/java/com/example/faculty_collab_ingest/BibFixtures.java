package com.example.faculty_collab_ingest;

import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 集成测试共用的 .bib 内容和名单路径
 */
public final class BibFixtures {

    public static final Path ROSTER = Paths.get("src/test/resources/roster/faculty_roster.json");

    public static final String ALOK_FILE = "01_1744-1.bib";
    public static final String SATISH_FILE = "s_SatishNarayanaSrirama.bib";
    public static final String RAJEEV_FILE = "w_RajeevWankar.bib";

    public static final String K123 = "@article{K123,\n"
            + "  author  = {Alok Singh and Rajeev Wankar and Jane Doe},\n"
            + "  title   = {Shared Work},\n"
            + "  journal = {J. Par. Comp.},\n"
            + "  year    = {2020}\n"
            + "}\n";

    public static final String ALOK_BIB = K123
            + "@inproceedings{K200,\n"
            + "  author    = {Alok Singh and Jane Doe},\n"
            + "  title     = {Second},\n"
            + "  booktitle = {HiPC},\n"
            + "  year      = {2018}\n"
            + "}\n";

    public static final String SATISH_BIB = "@article{K400,\n"
            + "  author  = {Satish Narayana Srirama and Jane Doe},\n"
            + "  title   = {Mobile Cloud},\n"
            + "  journal = {J. Par. Comp.},\n"
            + "  year    = {2019}\n"
            + "}\n";

    public static final String RAJEEV_BIB = K123
            + "@article{K300,\n"
            + "  author  = {Rajeev Wankar and Satish Srirama},\n"
            + "  title   = {Third},\n"
            + "  journal = {J. Par. Comp.},\n"
            + "  year    = {2022}\n"
            + "}\n";

    private BibFixtures() {
    }

    public static void writeAll(Path dir) throws IOException {
        write(dir, ALOK_FILE, ALOK_BIB);
        write(dir, SATISH_FILE, SATISH_BIB);
        write(dir, RAJEEV_FILE, RAJEEV_BIB);
    }

    public static Path write(Path dir, String fileName, String content) throws IOException {
        return Files.writeString(dir.resolve(fileName), content, StandardCharsets.UTF_8);
    }

    public static void clearDatabase(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.execute("DELETE FROM collaborations");
        jdbcTemplate.execute("DELETE FROM publication_authors");
        jdbcTemplate.execute("DELETE FROM publication_sources");
        jdbcTemplate.execute("DELETE FROM publications");
        jdbcTemplate.execute("DELETE FROM venues");
        jdbcTemplate.execute("DELETE FROM authors");
        jdbcTemplate.execute("DELETE FROM data_sources");
    }
}
