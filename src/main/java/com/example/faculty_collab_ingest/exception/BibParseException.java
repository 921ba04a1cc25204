package com.example.faculty_collab_ingest.exception;

/**
 * 单个 BibTeX 条目的解析错误，只影响该条目，不会中断整个文件。
 */
public class BibParseException extends RuntimeException {

    private final String entryKey;
    private final int line;

    public BibParseException(String message, String entryKey, int line) {
        super(message + " (line " + line + (entryKey != null ? ", key " + entryKey : "") + ")");
        this.entryKey = entryKey;
        this.line = line;
    }

    public String getEntryKey() {
        return entryKey;
    }

    public int getLine() {
        return line;
    }
}
