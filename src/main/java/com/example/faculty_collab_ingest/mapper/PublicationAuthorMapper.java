package com.example.faculty_collab_ingest.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.faculty_collab_ingest.model.PublicationAuthor;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface PublicationAuthorMapper extends BaseMapper<PublicationAuthor> {
    /**
     * 统计所有教师作者各自的论文数量
     * 返回列表元素为 Map，包含键：authorId（Long），cnt（Integer）
     */
    java.util.List<java.util.Map<String, Object>> selectFacultyPublicationCounts();

    /**
     * 统计两位作者共同署名的不同论文数量
     */
    long countSharedPublications(@Param("author1Id") Long author1Id, @Param("author2Id") Long author2Id);
}
