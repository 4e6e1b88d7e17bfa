package com.inkwell.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 章节大纲（JSON列）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChapterOutline {

    /**
     * 本章目标
     */
    private String goal;

    /**
     * 场景列表，按出场顺序
     */
    private List<String> scenes;

    /**
     * 结尾钩子
     */
    private String hookEnding;
}
