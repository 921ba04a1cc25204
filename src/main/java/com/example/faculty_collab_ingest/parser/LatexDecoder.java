package com.example.faculty_collab_ingest.parser;

import java.text.Normalizer;
import java.util.Map;

/**
 * 将 BibTeX 字段中的 LaTeX 重音命令和特殊字符转换为 Unicode，去掉保护性花括号并压缩空白。
 * 例如 {@code M{\"u}ller} 转换为 {@code Müller}，{@code Andr\'{e}} 转换为 {@code André}。
 */
public final class LatexDecoder {

    // 符号型重音命令 -> 组合字符
    private static final Map<Character, Character> SYMBOL_ACCENTS = Map.of(
            '\'', '\u0301',
            '`', '\u0300',
            '^', '\u0302',
            '"', '\u0308',
            '~', '\u0303',
            '=', '\u0304',
            '.', '\u0307');

    // 字母型重音命令 -> 组合字符
    private static final Map<String, Character> LETTER_ACCENTS = Map.of(
            "u", '\u0306',
            "v", '\u030c',
            "H", '\u030b',
            "c", '\u0327',
            "k", '\u0328',
            "r", '\u030a',
            "d", '\u0323',
            "b", '\u0331');

    private static final Map<String, String> SPECIALS = Map.ofEntries(
            Map.entry("ss", "ß"), Map.entry("o", "ø"), Map.entry("O", "Ø"),
            Map.entry("aa", "å"), Map.entry("AA", "Å"), Map.entry("ae", "æ"),
            Map.entry("AE", "Æ"), Map.entry("oe", "œ"), Map.entry("OE", "Œ"),
            Map.entry("l", "ł"), Map.entry("L", "Ł"), Map.entry("i", "ı"),
            Map.entry("j", "ȷ"), Map.entry("dh", "ð"), Map.entry("DH", "Ð"),
            Map.entry("th", "þ"), Map.entry("TH", "Þ"));

    private static final String ESCAPABLE = "&%_$#{}";

    private LatexDecoder() {
    }

    public static String decode(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String decoded = Normalizer.normalize(decodeFragment(raw), Normalizer.Form.NFC);
        return decoded.replaceAll("\\s+", " ").trim();
    }

    private static String decodeFragment(String s) {
        StringBuilder out = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char ch = s.charAt(i);
            if (ch == '\\' && i + 1 < s.length()) {
                i = decodeCommand(s, i + 1, out);
            } else if (ch == '{' || ch == '}') {
                i++;
            } else if (ch == '~') {
                out.append(' ');
                i++;
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * 处理反斜杠后的命令，返回命令之后的位置
     */
    private static int decodeCommand(String s, int i, StringBuilder out) {
        char ch = s.charAt(i);
        if (ESCAPABLE.indexOf(ch) >= 0) {
            out.append(ch);
            return i + 1;
        }
        if (SYMBOL_ACCENTS.containsKey(ch)) {
            return applyAccent(s, i + 1, SYMBOL_ACCENTS.get(ch), out);
        }
        if (!Character.isLetter(ch)) {
            // 例如 "\ " 或 "\\"
            out.append(' ');
            return i + 1;
        }
        int end = i;
        while (end < s.length() && Character.isLetter(s.charAt(end))) {
            end++;
        }
        String name = s.substring(i, end);
        if (LETTER_ACCENTS.containsKey(name)) {
            return applyAccent(s, end, LETTER_ACCENTS.get(name), out);
        }
        String special = SPECIALS.get(name);
        if (special != null) {
            out.append(special);
            return skipTerminator(s, end);
        }
        // 未知命令（如 \emph）只去掉命令名，参数由外层去括号保留
        return skipTerminator(s, end);
    }

    private static int applyAccent(String s, int i, char combining, StringBuilder out) {
        while (i < s.length() && s.charAt(i) == ' ') {
            i++;
        }
        if (i >= s.length()) {
            return i;
        }
        String argument;
        int next;
        if (s.charAt(i) == '{') {
            int close = matchingBrace(s, i);
            argument = decodeFragment(s.substring(i + 1, close));
            next = Math.min(close + 1, s.length());
        } else if (s.charAt(i) == '\\') {
            StringBuilder nested = new StringBuilder();
            next = decodeCommand(s, i + 1, nested);
            argument = nested.toString();
        } else {
            argument = String.valueOf(s.charAt(i));
            next = i + 1;
        }
        if (argument.isEmpty()) {
            return next;
        }
        char base = argument.charAt(0);
        if (base == 'ı') {
            base = 'i';
        } else if (base == 'ȷ') {
            base = 'j';
        }
        out.append(base).append(combining).append(argument, 1, argument.length());
        return next;
    }

    private static int matchingBrace(String s, int open) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return s.length();
    }

    private static int skipTerminator(String s, int i) {
        if (i < s.length() && s.charAt(i) == ' ') {
            return i + 1;
        }
        return i;
    }
}
