package com.inkwell.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.inkwell.domain.entity.Foreshadowing;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface ForeshadowingRepository extends BaseMapper<Foreshadowing> {

    @Select("SELECT * FROM foreshadowing WHERE status = 'active' ORDER BY created_at ASC, id ASC")
    List<Foreshadowing> findActive();
}
