package com.inkwell.context.tier;

import com.inkwell.context.ContextItem;
import com.inkwell.domain.entity.Chapter;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一次组装中各层共享的输入。前一章只解析一次，L1 和 L3 共用。
 */
@Value
@Builder
public class ChapterScope {

    Chapter chapter;

    /**
     * 紧邻的前一章（带正文），可能为空
     */
    Chapter previousChapter;

    List<ContextItem> pinnedItems;
}
