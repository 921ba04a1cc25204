package com.example.faculty_collab_ingest.parser;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个原始 BibTeX 条目，字段名统一为小写，字段值保留 LaTeX 原文。
 */
@Getter
public class BibtexEntry {

    private final String type;
    private final String key;
    private final int line;
    private final Map<String, String> fields = new LinkedHashMap<>();

    public BibtexEntry(String type, String key, int line) {
        this.type = type;
        this.key = key;
        this.line = line;
    }

    void putField(String name, String value) {
        // 同一条目内重复字段保留第一次出现的值
        fields.putIfAbsent(name.toLowerCase(), value);
    }

    public String getRaw(String name) {
        return fields.get(name.toLowerCase());
    }

    /**
     * 返回解码为 Unicode 并压缩空白后的字段值，字段不存在时返回空串
     */
    public String get(String name) {
        String raw = getRaw(name);
        return raw == null ? "" : LatexDecoder.decode(raw);
    }

    public Map<String, String> getFields() {
        return Collections.unmodifiableMap(fields);
    }
}
