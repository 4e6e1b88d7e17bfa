package com.inkwell.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.inkwell.domain.entity.Hook;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface HookRepository extends BaseMapper<Hook> {

    @Select("SELECT * FROM hooks WHERE chapter_id = #{chapterId} ORDER BY created_at ASC, id ASC")
    List<Hook> findByChapterId(@Param("chapterId") Long chapterId);
}
