package com.inkwell.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 上下文条目类型（封闭集合）
 *
 * 每个类型在声明处绑定所属的格式化分组，新增类型时必须显式指定分组。
 */
public enum ContextItemType {

    CHAPTER_CONTENT("chapter_content", ContextSection.PRECEDING_NARRATIVE),
    CHAPTER_OUTLINE("chapter_outline", ContextSection.OUTLINE),
    CHAPTER_PREV_TAIL("chapter_prev_tail", ContextSection.PRECEDING_NARRATIVE),
    CHARACTER("character", ContextSection.CHARACTERS),
    RELATIONSHIP("relationship", ContextSection.CHARACTERS),
    LOCATION("location", ContextSection.WORLD_RULES),
    ARC("arc", ContextSection.OUTLINE),
    FORESHADOWING("foreshadowing", ContextSection.PLOT_THREADS),
    HOOK("hook", ContextSection.PLOT_THREADS),
    POWER_SYSTEM("power_system", ContextSection.WORLD_RULES),
    SOCIAL_RULES("social_rules", ContextSection.WORLD_RULES),
    CUSTOM("custom", ContextSection.EXTRAS);

    private final String value;
    private final ContextSection section;

    ContextItemType(String value, ContextSection section) {
        this.value = value;
        this.section = section;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public ContextSection getSection() {
        return section;
    }

    @JsonCreator
    public static ContextItemType fromValue(String value) {
        for (ContextItemType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的上下文条目类型: " + value);
    }
}
