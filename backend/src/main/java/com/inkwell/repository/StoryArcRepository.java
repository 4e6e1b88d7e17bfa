package com.inkwell.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.inkwell.domain.entity.StoryArc;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface StoryArcRepository extends BaseMapper<StoryArc> {
}
