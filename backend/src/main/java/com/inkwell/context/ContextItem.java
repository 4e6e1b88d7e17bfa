package com.inkwell.context;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 上下文条目，每次组装时新建，不落库
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ContextItem {

    ContextItemType type;

    /**
     * 同类型内唯一，用于去重和钉选
     */
    String id;

    /**
     * 已渲染好的可读文本
     */
    String content;

    /**
     * 越大越重要；调用方钉选的条目可以不填，由 L5 补默认值
     */
    Integer priority;

    public int priorityValue() {
        return priority == null ? 0 : priority;
    }
}
