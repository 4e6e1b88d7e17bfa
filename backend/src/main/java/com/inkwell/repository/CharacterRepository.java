package com.inkwell.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.inkwell.domain.entity.Character;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface CharacterRepository extends BaseMapper<Character> {
}
