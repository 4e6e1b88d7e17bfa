package com.inkwell.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.inkwell.domain.entity.World;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.ResultMap;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface WorldRepository extends BaseMapper<World> {

    /**
     * 世界观是单例记录，没有则返回 null
     */
    @ResultMap("mybatis-plus_World")
    @Select("SELECT * FROM world ORDER BY id ASC LIMIT 1")
    World findFirst();
}
