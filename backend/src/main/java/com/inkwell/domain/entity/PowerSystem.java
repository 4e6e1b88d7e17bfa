package com.inkwell.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 力量体系（World 的 JSON 子记录）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PowerSystem {

    private String name;

    /**
     * 等级，由低到高
     */
    private List<String> levels;

    private List<String> coreRules;

    private List<String> constraints;
}
