package com.example.faculty_collab_ingest.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 数据源同步记录
 */
@Data
@TableName("data_sources")
public class DataSource {
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_ERROR = "error";

    @TableId(type = IdType.AUTO)
    private Long id;
    private String sourceName;
    private LocalDateTime lastSync;
    private Integer totalRecords;
    private String status;
    private String errorMessage;
    private LocalDateTime updatedAt;
}
