package com.inkwell.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 角色实体类
 */
@Data
@TableName(value = "characters", autoResultMap = true)
public class Character {

    /**
     * 角色编号，如 C001
     */
    @TableId(type = IdType.INPUT)
    private String id;

    private String name;

    /**
     * main / supporting / antagonist / mentioned
     */
    private String role;

    private String appearance;

    @TableField(value = "voice_samples", typeHandler = JacksonTypeHandler.class)
    private List<String> voiceSamples;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private CharacterMotivation motivation;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private CharacterFacets facets;

    @TableField("conflict_type")
    private String conflictType;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime updatedAt;
}
