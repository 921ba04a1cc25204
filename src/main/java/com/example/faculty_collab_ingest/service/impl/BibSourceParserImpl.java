package com.example.faculty_collab_ingest.service.impl;

import com.example.faculty_collab_ingest.dto.FacultyRoster;
import com.example.faculty_collab_ingest.dto.ParsedPublication;
import com.example.faculty_collab_ingest.dto.SourceParseResult;
import com.example.faculty_collab_ingest.exception.BibParseException;
import com.example.faculty_collab_ingest.model.Venue;
import com.example.faculty_collab_ingest.parser.BibtexEntry;
import com.example.faculty_collab_ingest.parser.BibtexParseResult;
import com.example.faculty_collab_ingest.parser.BibtexParser;
import com.example.faculty_collab_ingest.parser.LatexDecoder;
import com.example.faculty_collab_ingest.service.BibSourceParser;
import com.example.faculty_collab_ingest.util.NameNormalizer;
import com.example.faculty_collab_ingest.util.SourceFileNaming;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * 将 BibTeX 条目规范化为 {@link ParsedPublication}
 */
@Slf4j
@Service
public class BibSourceParserImpl implements BibSourceParser {

    private static final Map<String, String> TYPE_MAPPING = Map.of(
            "article", "article",
            "inproceedings", "conference",
            "proceedings", "proceedings",
            "book", "book",
            "incollection", "book_chapter",
            "phdthesis", "thesis",
            "mastersthesis", "thesis",
            "techreport", "technical_report",
            "misc", "misc");

    private final BibtexParser bibtexParser = new BibtexParser();

    @Override
    public SourceParseResult parseFile(Path file, String sourcePid) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        SourceParseResult result = parse(content, sourcePid, file.getFileName().toString());
        result.setFile(file);
        return result;
    }

    @Override
    public SourceParseResult parse(String content, String sourcePid, String sourceName) {
        SourceParseResult result = new SourceParseResult();
        result.setSourcePid(sourcePid);

        BibtexParseResult parsed = bibtexParser.parse(content);
        for (BibParseException error : parsed.getErrors()) {
            log.warn("解析 {} 时跳过错误条目: {}", sourceName, error.getMessage());
            result.getErrorMessages().add(error.getMessage());
        }
        result.setParseErrors(parsed.getErrors().size());
        result.setEntriesParsed(parsed.getEntries().size());

        // 仅在当前文件内去重，跨文件的合并在入库时完成
        Set<String> seenKeys = new HashSet<>();
        Set<String> seenDois = new HashSet<>();
        int duplicates = 0;
        for (BibtexEntry entry : parsed.getEntries()) {
            String key = entry.getKey().trim();
            if (!seenKeys.add(key)) {
                duplicates++;
                log.debug("{} 中的重复键: {}", sourceName, key);
                continue;
            }
            String doi = entry.get("doi").toUpperCase(Locale.ROOT);
            if (!doi.isEmpty() && !seenDois.add(doi)) {
                duplicates++;
                log.debug("{} 中的重复 DOI: {}", sourceName, doi);
                continue;
            }
            result.getPublications().add(toPublication(entry, key, doi, sourcePid));
        }
        result.setDuplicates(duplicates);
        log.info("解析 {} 完成: 条目 {}，有效 {}，重复 {}，错误 {}", sourceName,
                result.getEntriesParsed(), result.getPublications().size(), duplicates, result.getParseErrors());
        return result;
    }

    private ParsedPublication toPublication(BibtexEntry entry, String key, String doi, String sourcePid) {
        ParsedPublication pub = new ParsedPublication();
        pub.setDblpKey(key);
        pub.setSourcePid(sourcePid);
        pub.setEntryType(entry.getType());
        pub.setPublicationType(TYPE_MAPPING.getOrDefault(entry.getType(), "unknown"));
        pub.setDoi(doi.isEmpty() ? null : doi);

        String title = entry.get("title");
        pub.setTitle(title);
        pub.setNormalizedTitle(NameNormalizer.normalizeTitle(title));
        pub.setYear(parseYear(entry.get("year")));

        pub.setJournal(emptyToNull(entry.get("journal")));
        pub.setBooktitle(emptyToNull(entry.get("booktitle")));
        pub.setVolume(emptyToNull(entry.get("volume")));
        pub.setNumber(emptyToNull(entry.get("number")));
        pub.setPages(emptyToNull(entry.get("pages")));
        pub.setPublisher(emptyToNull(entry.get("publisher")));
        pub.setSeries(emptyToNull(entry.get("series")));
        pub.setUrl(emptyToNull(entry.get("url")));
        pub.setEe(emptyToNull(entry.get("ee")));
        pub.setBiburl(emptyToNull(entry.get("biburl")));
        pub.setBibsource(emptyToNull(entry.get("bibsource")));
        pub.setAbstractText(emptyToNull(entry.get("abstract")));
        pub.setKeywords(emptyToNull(entry.get("keywords")));

        if (pub.getJournal() != null) {
            pub.setVenueName(pub.getJournal());
            pub.setVenueType(Venue.TYPE_JOURNAL);
        } else if (pub.getBooktitle() != null) {
            pub.setVenueName(pub.getBooktitle());
            pub.setVenueType("inproceedings".equals(entry.getType()) || "proceedings".equals(entry.getType())
                    ? Venue.TYPE_CONFERENCE : Venue.TYPE_OTHER);
        }

        pub.setAuthors(splitNames(entry.getRaw("author")));
        pub.setEditors(splitNames(entry.getRaw("editor")));
        return pub;
    }

    /**
     * 按最外层的 "and" 拆分人名列表，花括号内的 and 属于名字本身
     */
    static List<String> splitNames(String raw) {
        List<String> names = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return names;
        }
        int depth = 0;
        int start = 0;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && Character.isWhitespace(ch) && isAndSeparator(raw, i)) {
                addName(names, raw.substring(start, i));
                int j = i + 1;
                while (Character.isWhitespace(raw.charAt(j))) {
                    j++;
                }
                start = j + 3;
                i = start - 1;
            }
        }
        addName(names, raw.substring(Math.min(start, raw.length())));
        return names;
    }

    // raw[i] 为空白，判断其后是否为 "and" 加空白
    private static boolean isAndSeparator(String raw, int i) {
        int j = i;
        while (j < raw.length() && Character.isWhitespace(raw.charAt(j))) {
            j++;
        }
        return j + 3 < raw.length()
                && raw.regionMatches(true, j, "and", 0, 3)
                && Character.isWhitespace(raw.charAt(j + 3));
    }

    private static void addName(List<String> names, String raw) {
        String name = LatexDecoder.decode(raw);
        if (!name.isEmpty()) {
            names.add(name);
        }
    }

    private static Integer parseYear(String year) {
        int end = 0;
        while (end < year.length() && Character.isDigit(year.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return null;
        }
        try {
            return Integer.parseInt(year.substring(0, end));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public String resolveSourcePid(Path file, FacultyRoster roster) {
        String stem = SourceFileNaming.stemOf(file.getFileName().toString());
        for (String candidate : SourceFileNaming.candidateStems(stem)) {
            Optional<String> pid = roster.findPidBySanitized(candidate);
            if (pid.isPresent()) {
                return pid.get();
            }
        }
        String fallback = SourceFileNaming.fallbackPid(stem);
        log.debug("文件 {} 不在教师名单中，按文件名推断 PID: {}", file.getFileName(), fallback);
        return fallback;
    }
}
