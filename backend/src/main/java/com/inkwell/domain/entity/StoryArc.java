package com.inkwell.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.inkwell.repository.handler.ArcSectionListTypeHandler;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 故事弧实体类（主线 / 支线）
 */
@Data
@TableName(value = "arcs", autoResultMap = true)
public class StoryArc {

    @TableId(type = IdType.INPUT)
    private String id;

    private String name;

    /**
     * main / sub
     */
    private String type;

    /**
     * planned / in_progress / complete
     */
    private String status;

    private Integer progress;

    @TableField(typeHandler = ArcSectionListTypeHandler.class)
    private List<ArcSection> sections;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime updatedAt;
}
