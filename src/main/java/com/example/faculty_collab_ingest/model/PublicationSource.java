package com.example.faculty_collab_ingest.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

@Data
@TableName("publication_sources")
public class PublicationSource {
    @TableId(type = IdType.AUTO)
    private Long id;
    private Long publicationId;
    private String sourcePid;
}
