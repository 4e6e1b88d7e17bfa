package com.inkwell.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 角色动机：表面 / 隐藏 / 核心
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CharacterMotivation {

    private String surface;

    private String hidden;

    private String core;
}
