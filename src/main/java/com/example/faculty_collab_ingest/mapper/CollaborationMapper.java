package com.example.faculty_collab_ingest.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.faculty_collab_ingest.model.Collaboration;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface CollaborationMapper extends BaseMapper<Collaboration> {

    /**
     * 统计某位作者的合作者数量
     */
    long countByAuthor(@Param("authorId") Long authorId);
}
