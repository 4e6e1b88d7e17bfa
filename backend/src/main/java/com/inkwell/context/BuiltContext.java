package com.inkwell.context;

import lombok.Value;

import java.util.List;

/**
 * 组装结果
 */
@Value
public class BuiltContext {

    /**
     * 按优先级排好序的入选条目
     */
    List<ContextItem> items;

    int totalTokens;

    /**
     * 至少有一个候选条目因预算被丢弃
     */
    boolean truncated;
}
