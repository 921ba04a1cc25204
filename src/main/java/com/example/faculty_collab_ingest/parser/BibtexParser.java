package com.example.faculty_collab_ingest.parser;

import com.example.faculty_collab_ingest.exception.BibParseException;

import java.util.HashMap;
import java.util.Map;

/**
 * BibTeX 文本解析器。
 * 支持 {} 与 () 两种条目定界符、嵌套花括号、# 拼接、@string 宏以及月份宏；
 * 忽略 @comment 与 @preamble。条目之间的非条目文本按注释处理。
 * 单个条目出错时记录 {@link BibParseException} 并跳到下一个条目继续解析。
 */
public class BibtexParser {

    private static final Map<String, String> MONTH_MACROS = Map.ofEntries(
            Map.entry("jan", "January"), Map.entry("feb", "February"), Map.entry("mar", "March"),
            Map.entry("apr", "April"), Map.entry("may", "May"), Map.entry("jun", "June"),
            Map.entry("jul", "July"), Map.entry("aug", "August"), Map.entry("sep", "September"),
            Map.entry("oct", "October"), Map.entry("nov", "November"), Map.entry("dec", "December"));

    public BibtexParseResult parse(String text) {
        BibtexParseResult result = new BibtexParseResult();
        if (text == null || text.isEmpty()) {
            return result;
        }
        Cursor cursor = new Cursor(text);
        Map<String, String> macros = new HashMap<>(MONTH_MACROS);
        while (cursor.seek('@')) {
            int start = cursor.pos;
            try {
                parseItem(cursor, macros, result);
            } catch (BibParseException e) {
                result.addError(e);
                cursor.recoverFrom(start + 1);
            }
        }
        return result;
    }

    private void parseItem(Cursor c, Map<String, String> macros, BibtexParseResult result) {
        int line = c.line(c.pos);
        c.pos++;
        String type = c.readIdentifier().toLowerCase();
        c.skipWhitespace();
        if (type.isEmpty() || c.eof() || (c.peek() != '{' && c.peek() != '(')) {
            // 不是条目，例如注释里的邮箱地址
            return;
        }
        char close = c.next() == '{' ? '}' : ')';

        switch (type) {
            case "comment":
            case "preamble":
                c.skipUntilClose(close, line);
                return;
            case "string":
                parseStringMacro(c, macros, close, line);
                return;
            default:
                result.addEntry(parseEntry(c, type, macros, close, line));
        }
    }

    private void parseStringMacro(Cursor c, Map<String, String> macros, char close, int line) {
        c.skipWhitespace();
        String name = c.readIdentifier();
        if (name.isEmpty()) {
            throw new BibParseException("@string without macro name", null, line);
        }
        c.skipWhitespace();
        c.expect('=', null, line);
        String value = readValue(c, macros, null, line);
        c.skipWhitespace();
        c.expect(close, null, line);
        macros.put(name.toLowerCase(), value);
    }

    private BibtexEntry parseEntry(Cursor c, String type, Map<String, String> macros, char close, int line) {
        c.skipWhitespace();
        int keyStart = c.pos;
        while (!c.eof() && !isKeyTerminator(c.peek(), close)) {
            c.pos++;
        }
        String key = c.text.substring(keyStart, c.pos);
        c.skipWhitespace();
        if (key.isEmpty() || c.eof() || c.peek() == '=') {
            throw new BibParseException("Entry of type @" + type + " without key", null, line);
        }

        BibtexEntry entry = new BibtexEntry(type, key, line);
        while (true) {
            c.skipWhitespace();
            if (c.eof()) {
                throw new BibParseException("Unterminated entry", key, line);
            }
            char ch = c.peek();
            if (ch == close) {
                c.pos++;
                return entry;
            }
            if (ch == ',') {
                c.pos++;
                continue;
            }
            String name = c.readIdentifier();
            if (name.isEmpty()) {
                throw new BibParseException("Unexpected character '" + ch + "'", key, c.line(c.pos));
            }
            c.skipWhitespace();
            c.expect('=', key, line);
            entry.putField(name, readValue(c, macros, key, line));
        }
    }

    private String readValue(Cursor c, Map<String, String> macros, String key, int line) {
        StringBuilder value = new StringBuilder();
        while (true) {
            c.skipWhitespace();
            if (c.eof()) {
                throw new BibParseException("Missing field value", key, line);
            }
            char ch = c.peek();
            if (ch == '{') {
                value.append(c.readBraced(key, line));
            } else if (ch == '"') {
                value.append(c.readQuoted(key, line));
            } else if (Character.isDigit(ch)) {
                value.append(c.readIdentifier());
            } else if (Character.isLetter(ch)) {
                String macro = c.readIdentifier();
                value.append(macros.getOrDefault(macro.toLowerCase(), macro));
            } else {
                throw new BibParseException("Unexpected character '" + ch + "' in field value", key, c.line(c.pos));
            }
            c.skipWhitespace();
            if (!c.eof() && c.peek() == '#') {
                c.pos++;
                continue;
            }
            return value.toString();
        }
    }

    private static boolean isKeyTerminator(char ch, char close) {
        return ch == ',' || ch == '=' || ch == close || ch == '}' || Character.isWhitespace(ch);
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        private Cursor(String text) {
            this.text = text;
        }

        boolean eof() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        char next() {
            return text.charAt(pos++);
        }

        boolean seek(char target) {
            int idx = text.indexOf(target, pos);
            if (idx < 0) {
                pos = text.length();
                return false;
            }
            pos = idx;
            return true;
        }

        void skipWhitespace() {
            while (!eof() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        void expect(char expected, String key, int line) {
            if (eof() || peek() != expected) {
                String found = eof() ? "end of input" : "'" + peek() + "'";
                throw new BibParseException("Expected '" + expected + "' but found " + found, key, line);
            }
            pos++;
        }

        String readIdentifier() {
            int start = pos;
            while (!eof()) {
                char ch = peek();
                if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == ':' || ch == '.' || ch == '+') {
                    pos++;
                } else {
                    break;
                }
            }
            return text.substring(start, pos);
        }

        String readBraced(String key, int line) {
            int depth = 0;
            int start = pos + 1;
            while (!eof()) {
                char ch = next();
                if (ch == '\\') {
                    pos++;
                } else if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, pos - 1);
                    }
                }
            }
            throw new BibParseException("Unbalanced braces", key, line);
        }

        String readQuoted(String key, int line) {
            pos++;
            int start = pos;
            int depth = 0;
            while (!eof()) {
                char ch = next();
                if (ch == '\\') {
                    pos++;
                } else if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                } else if (ch == '"' && depth == 0) {
                    return text.substring(start, pos - 1);
                }
            }
            throw new BibParseException("Unterminated quoted value", key, line);
        }

        void skipUntilClose(char close, int line) {
            int depth = 0;
            while (!eof()) {
                char ch = next();
                if (ch == '{') {
                    depth++;
                } else if (ch == '}' && depth > 0) {
                    depth--;
                } else if (ch == close && depth == 0) {
                    return;
                }
            }
            throw new BibParseException("Unterminated block", null, line);
        }

        /**
         * 出错后跳到下一个位于行首的 @
         */
        void recoverFrom(int from) {
            int idx = from;
            while ((idx = text.indexOf('@', idx)) >= 0) {
                if (atLineStart(idx)) {
                    pos = idx;
                    return;
                }
                idx++;
            }
            pos = text.length();
        }

        private boolean atLineStart(int idx) {
            int j = idx - 1;
            while (j >= 0 && (text.charAt(j) == ' ' || text.charAt(j) == '\t')) {
                j--;
            }
            return j < 0 || text.charAt(j) == '\n' || text.charAt(j) == '\r';
        }

        int line(int at) {
            int line = 1;
            int limit = Math.min(at, text.length());
            for (int i = 0; i < limit; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                }
            }
            return line;
        }
    }
}
