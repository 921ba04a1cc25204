package com.example.faculty_collab_ingest.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 作者实体，按规范化姓名唯一。
 * dblpPid、email、phone、designation、department、hindex 以及统计字段仅在 isFaculty 为 true 时有值。
 */
@Data
@TableName("authors")
public class Author {
    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;

    private String normalizedName;

    private Boolean isFaculty;

    // 以下为教师专属字段
    private String dblpPid;
    private String email;
    private String phone;
    private String designation;
    private String department;
    @TableField("h_index")
    private Integer hindex;
    private Integer totalPublications;
    private Integer totalCollaborations;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isFacultyMember() {
        return Boolean.TRUE.equals(isFaculty);
    }
}
