package com.inkwell.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 角色关系（有向：source → target）
 */
@Data
@TableName("relationships")
public class Relationship {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("source_id")
    private String sourceId;

    @TableField("target_id")
    private String targetId;

    /**
     * companion / rival / enemy / mentor / confidant / lover
     */
    private String type;

    /**
     * 结缘原因
     */
    @TableField("join_reason")
    private String joinReason;

    /**
     * 独立目标
     */
    @TableField("independent_goal")
    private String independentGoal;

    private String evolution;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime updatedAt;
}
