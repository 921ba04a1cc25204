package com.example.faculty_collab_ingest.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.faculty_collab_ingest.model.PublicationSource;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;

@Mapper
public interface PublicationSourceMapper extends BaseMapper<PublicationSource> {

    /**
     * 统计来源集合包含任一指定 PID 的不同论文数量
     */
    long countPublicationsBySourcePids(@Param("pids") Collection<String> pids);
}
