package com.example.faculty_collab_ingest.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 合作关系边，author1Id 总是小于 author2Id。
 */
@Data
@TableName("collaborations")
public class Collaboration {
    @TableId(type = IdType.AUTO)
    private Long id;
    private Long author1Id;
    private Long author2Id;
    private Integer collaborationCount;
    private Integer firstCollaborationYear;
    private Integer lastCollaborationYear;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
