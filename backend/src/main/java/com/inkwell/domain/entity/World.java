package com.inkwell.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 世界观设定，全局最多一条
 */
@Data
@TableName(value = "world", autoResultMap = true)
public class World {

    @TableId(type = IdType.INPUT)
    private String id;

    @TableField(value = "power_system", typeHandler = JacksonTypeHandler.class)
    private PowerSystem powerSystem;

    @TableField(value = "social_rules", typeHandler = JacksonTypeHandler.class)
    private Map<String, String> socialRules;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime updatedAt;
}
