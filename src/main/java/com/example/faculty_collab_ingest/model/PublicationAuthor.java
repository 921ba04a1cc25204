package com.example.faculty_collab_ingest.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

@Data
@TableName("publication_authors")
public class PublicationAuthor {
    @TableId(type = IdType.AUTO)
    private Long id;
    private Long publicationId;
    private Long authorId;
    // 作者在论文作者列表中的位置，从 1 开始
    private Integer authorPosition;
}
