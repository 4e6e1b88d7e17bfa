package com.inkwell.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 章节实体类
 *
 * 除正文外还保存本章的大纲以及指向角色、地点、伏笔、故事弧的外键列表，
 * 这些外键是组装生成上下文时展开的依据。
 */
@Data
@TableName(value = "chapters", autoResultMap = true)
public class Chapter {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("volume_id")
    private Long volumeId;

    @TableField("arc_id")
    private String arcId;

    private String title;

    private String status;

    /**
     * 卷内排序键，前一章的判定以它为准
     */
    @TableField("sort_order")
    private Integer sortOrder;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private ChapterOutline outline;

    private String content;

    @TableField("word_count")
    private Integer wordCount = 0;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> characters;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> locations;

    @TableField(value = "foreshadowing_planted", typeHandler = JacksonTypeHandler.class)
    private List<String> foreshadowingPlanted;

    @TableField(value = "foreshadowing_hinted", typeHandler = JacksonTypeHandler.class)
    private List<String> foreshadowingHinted;

    @TableField(value = "foreshadowing_resolved", typeHandler = JacksonTypeHandler.class)
    private List<String> foreshadowingResolved;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime updatedAt;

}
