package com.example.faculty_collab_ingest.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 期刊/会议实体，按 (normalizedName, venueType) 唯一。
 */
@Data
@TableName("venues")
public class Venue {
    public static final String TYPE_JOURNAL = "journal";
    public static final String TYPE_CONFERENCE = "conference";
    public static final String TYPE_OTHER = "other";

    @TableId(type = IdType.AUTO)
    private Long id;
    private String name;
    private String normalizedName;
    private String venueType;
    private String publisher;
    private Integer totalPublications;
    private Integer facultyPublications;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
