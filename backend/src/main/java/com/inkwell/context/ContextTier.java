package com.inkwell.context;

/**
 * 五层相关度分级，L1 最重要
 */
public enum ContextTier {

    /** 必需：本章正文、大纲、前一章末尾 */
    L1_REQUIRED,
    /** 外键展开：角色、关系、地点、故事弧 */
    L2_FK_EXPANSION,
    /** 剧情感知：伏笔、上章钩子 */
    L3_PLOT_AWARENESS,
    /** 世界规则：力量体系、社会规则 */
    L4_WORLD_RULES,
    /** 调用方钉选的条目 */
    L5_PINNED
}
