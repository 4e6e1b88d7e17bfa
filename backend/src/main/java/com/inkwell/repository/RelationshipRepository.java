package com.inkwell.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.inkwell.domain.entity.Relationship;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface RelationshipRepository extends BaseMapper<Relationship> {

    /**
     * 有向查询：只匹配 source → target，反方向需要调换参数再查一次
     */
    @Select("SELECT * FROM relationships WHERE source_id = #{sourceId} AND target_id = #{targetId} LIMIT 1")
    Relationship findBetween(@Param("sourceId") String sourceId, @Param("targetId") String targetId);
}
