package com.inkwell.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 钩子（章末悬念等）
 */
@Data
@TableName("hooks")
public class Hook {

    @TableId(type = IdType.INPUT)
    private String id;

    /**
     * opening / arc / chapter
     */
    private String type;

    @TableField("chapter_id")
    private Long chapterId;

    private String content;

    @TableField("hook_type")
    private String hookType;

    /**
     * 强度 0-100，可为空
     */
    private Integer strength;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdAt;
}
