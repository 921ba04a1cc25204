package com.example.faculty_collab_ingest.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析后的一条论文记录，字段均已解码为 Unicode
 */
@Data
public class ParsedPublication {
    private String dblpKey;
    private String sourcePid;
    private String entryType;
    private String publicationType;
    private String doi;
    private String title;
    private String normalizedTitle;
    private Integer year;

    private String venueName;
    private String venueType;

    private String journal;
    private String booktitle;
    private String volume;
    private String number;
    private String pages;
    private String publisher;
    private String series;
    private String url;
    private String ee;
    private String biburl;
    private String bibsource;
    private String abstractText;
    private String keywords;

    // 按署名顺序排列
    private List<String> authors = new ArrayList<>();
    private List<String> editors = new ArrayList<>();
}
