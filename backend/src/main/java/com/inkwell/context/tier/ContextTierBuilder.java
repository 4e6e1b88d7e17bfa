package com.inkwell.context.tier;

import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextTier;

import java.util.List;

/**
 * 单层候选条目生成器。只读仓储，不持有跨调用的状态。
 */
public interface ContextTierBuilder {

    ContextTier tier();

    List<ContextItem> build(ChapterScope scope);
}
