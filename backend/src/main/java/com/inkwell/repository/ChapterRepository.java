package com.inkwell.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.inkwell.domain.entity.Chapter;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * selectById 返回带正文的完整记录；列表查询只取元数据
 */
@Mapper
public interface ChapterRepository extends BaseMapper<Chapter> {

    @Select("SELECT id, volume_id, arc_id, title, status, sort_order FROM chapters WHERE volume_id = #{volumeId} ORDER BY sort_order ASC, id ASC")
    List<Chapter> findByVolumeId(@Param("volumeId") Long volumeId);

    @Select("SELECT id, volume_id, arc_id, title, status, sort_order FROM chapters ORDER BY sort_order ASC, id ASC")
    List<Chapter> findAllOrdered();
}
