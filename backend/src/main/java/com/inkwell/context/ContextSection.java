package com.inkwell.context;

/**
 * 格式化输出时的语义分组，声明顺序即输出顺序
 */
public enum ContextSection {

    PRECEDING_NARRATIVE("## 前文"),
    OUTLINE("## 本章大纲"),
    CHARACTERS("## 角色档案"),
    WORLD_RULES("## 世界规则"),
    PLOT_THREADS("## 剧情线索"),
    EXTRAS("## 补充信息");

    private final String heading;

    ContextSection(String heading) {
        this.heading = heading;
    }

    public String getHeading() {
        return heading;
    }
}
