package com.example.faculty_collab_ingest.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.faculty_collab_ingest.model.Publication;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface PublicationMapper extends BaseMapper<Publication> {
}
