package com.inkwell.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.inkwell.domain.entity.Location;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface LocationRepository extends BaseMapper<Location> {
}
