package com.example.faculty_collab_ingest.util;

import java.util.Locale;

/**
 * 姓名规范化工具：压缩空白、转小写、去掉句点和逗号。
 * 不去除 Dr、Prof 等称谓，作者去重和教师身份匹配都使用同一规则。
 */
public final class NameNormalizer {

    private NameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String normalized = name.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
        normalized = normalized.replace(".", "").replace(",", "");
        return normalized.trim();
    }

    /**
     * 标题规范化，仅用于展示和检索，不参与去重
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String normalized = title.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return normalized.replaceAll("[^\\p{L}\\p{N}\\s]", "").trim();
    }

    /**
     * 期刊/会议名规范化：压缩空白并转小写
     */
    public static String normalizeVenue(String venue) {
        if (venue == null) {
            return "";
        }
        return venue.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }
}
