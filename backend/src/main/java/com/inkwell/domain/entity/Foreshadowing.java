package com.inkwell.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 伏笔追踪实体类
 */
@Data
@TableName("foreshadowing")
public class Foreshadowing {

    @TableId(type = IdType.INPUT)
    private String id;

    private String content;

    @TableField("planted_chapter")
    private Long plantedChapter;

    @TableField("resolved_chapter")
    private Long resolvedChapter;

    private String status;

    /**
     * short / mid / long
     */
    private String term;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime updatedAt;

}
