package com.example.faculty_collab_ingest.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 教师 PID 与 .bib 文件名之间的映射规则。
 * 文件名为 PID 中的非字母数字分隔符替换为下划线，例如 "01/1744-1" 对应 "01_1744-1.bib"。
 */
public final class SourceFileNaming {

    public static final String BIB_EXTENSION = ".bib";

    private SourceFileNaming() {
    }

    public static String sanitizePid(String pid) {
        return pid.replaceAll("[^A-Za-z0-9-]", "_");
    }

    public static String fileNameFor(String pid) {
        return sanitizePid(pid) + BIB_EXTENSION;
    }

    public static String stemOf(String fileName) {
        return fileName.endsWith(BIB_EXTENSION)
                ? fileName.substring(0, fileName.length() - BIB_EXTENSION.length())
                : fileName;
    }

    /**
     * 文件名主干可能带有教师名后缀（如 "_alok"）或重复标记（如 "_1"），按从严到宽的顺序给出候选
     */
    public static List<String> candidateStems(String stem) {
        List<String> candidates = new ArrayList<>();
        candidates.add(stem);
        String[] parts = stem.split("_");
        int length = parts.length;
        if (length >= 3 && parts[length - 1].replace("-", "").chars().allMatch(Character::isLetter)) {
            length--;
            candidates.add(String.join("_", Arrays.copyOf(parts, length)));
        }
        if (length >= 2 && parts[length - 1].length() == 1 && Character.isDigit(parts[length - 1].charAt(0))) {
            length--;
            candidates.add(String.join("_", Arrays.copyOf(parts, length)));
        }
        return candidates;
    }

    /**
     * 名单中找不到时的回退规则：把第一个下划线还原为斜杠
     */
    public static String fallbackPid(String stem) {
        List<String> candidates = candidateStems(stem);
        return candidates.get(candidates.size() - 1).replaceFirst("_", "/");
    }
}
