package com.example.faculty_collab_ingest.parser;

import com.example.faculty_collab_ingest.exception.BibParseException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Getter
public class BibtexParseResult {

    private final List<BibtexEntry> entries = new ArrayList<>();
    private final List<BibParseException> errors = new ArrayList<>();

    void addEntry(BibtexEntry entry) {
        entries.add(entry);
    }

    void addError(BibParseException error) {
        errors.add(error);
    }

    /**
     * 所有不重复的条目键，保持出现顺序
     */
    public Set<String> distinctKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (BibtexEntry entry : entries) {
            keys.add(entry.getKey());
        }
        return keys;
    }
}
