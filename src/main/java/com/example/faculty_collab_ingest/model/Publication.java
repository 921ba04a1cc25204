package com.example.faculty_collab_ingest.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 论文实体，dblpKey 为唯一的外部键。
 * 来源教师集合存放在 publication_sources 表中，只增不减。
 */
@Data
@TableName("publications")
public class Publication {
    @TableId(type = IdType.AUTO)
    private Long id;

    private String dblpKey;
    private String doi;
    private String title;
    private String normalizedTitle;
    private String publicationType;
    private Integer year;
    private Long venueId;

    private String journal;
    private String booktitle;
    private String volume;
    private String number;
    private String pages;
    private String publisher;
    private String series;
    private String editor;
    private String url;
    private String ee;
    private String biburl;
    private String bibsource;
    private String abstractText;
    private String keywords;

    private Integer authorCount;
    private Boolean hasFacultyAuthor;

    // 首次贡献该论文的教师 PID
    private String sourcePid;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
