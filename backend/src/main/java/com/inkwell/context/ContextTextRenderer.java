package com.inkwell.context;

import com.inkwell.domain.entity.ArcSection;
import com.inkwell.domain.entity.Character;
import com.inkwell.domain.entity.CharacterFacets;
import com.inkwell.domain.entity.CharacterMotivation;
import com.inkwell.domain.entity.ChapterOutline;
import com.inkwell.domain.entity.Foreshadowing;
import com.inkwell.domain.entity.Hook;
import com.inkwell.domain.entity.Location;
import com.inkwell.domain.entity.PowerSystem;
import com.inkwell.domain.entity.Relationship;
import com.inkwell.domain.entity.StoryArc;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把引用实体渲染成可直接注入提示词的文本块
 */
public final class ContextTextRenderer {

    private ContextTextRenderer() {
    }

    /**
     * 目标、编号场景、结尾钩子；三者都为空时返回 null
     */
    public static String renderOutline(ChapterOutline outline) {
        if (outline == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (StringUtils.isNotEmpty(outline.getGoal())) {
            parts.add("目标: " + outline.getGoal());
        }
        if (outline.getScenes() != null && !outline.getScenes().isEmpty()) {
            StringBuilder scenes = new StringBuilder("场景:");
            for (int i = 0; i < outline.getScenes().size(); i++) {
                scenes.append("\n  ").append(i + 1).append(". ").append(outline.getScenes().get(i));
            }
            parts.add(scenes.toString());
        }
        if (StringUtils.isNotEmpty(outline.getHookEnding())) {
            parts.add("钩子结尾: " + outline.getHookEnding());
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    /**
     * 截取末尾若干字符（按码点计，不会拆开代理对）
     */
    public static String tail(String content, int length) {
        if (content.codePointCount(0, content.length()) <= length) {
            return content;
        }
        return content.substring(content.offsetByCodePoints(content.length(), -length));
    }

    public static String renderCharacter(Character character) {
        List<String> parts = new ArrayList<>();
        parts.add("### " + character.getName() + " (" + character.getRole() + ")");

        if (StringUtils.isNotBlank(character.getAppearance())) {
            parts.add("外貌: " + character.getAppearance());
        }

        CharacterMotivation motivation = character.getMotivation();
        if (motivation != null) {
            List<String> lines = new ArrayList<>();
            appendField(lines, "  表面: ", motivation.getSurface());
            appendField(lines, "  隐藏: ", motivation.getHidden());
            appendField(lines, "  核心: ", motivation.getCore());
            if (!lines.isEmpty()) {
                parts.add("动机:\n" + String.join("\n", lines));
            }
        }

        CharacterFacets facets = character.getFacets();
        if (facets != null) {
            List<String> lines = new ArrayList<>();
            appendField(lines, "  公开: ", facets.getPublicFace());
            appendField(lines, "  私下: ", facets.getPrivateFace());
            appendField(lines, "  隐藏: ", facets.getHidden());
            appendField(lines, "  压力下: ", facets.getUnderPressure());
            if (!lines.isEmpty()) {
                parts.add("性格面:\n" + String.join("\n", lines));
            }
        }

        List<String> voiceSamples = character.getVoiceSamples();
        if (voiceSamples != null && !voiceSamples.isEmpty() && StringUtils.isNotBlank(voiceSamples.get(0))) {
            parts.add("语音样本: \"" + voiceSamples.get(0) + "\"");
        }

        return String.join("\n", parts);
    }

    public static String renderRelationship(Relationship relationship, String sourceName, String targetName) {
        List<String> parts = new ArrayList<>();
        parts.add("[关系] " + sourceName + " → " + targetName + ": " + relationship.getType());
        appendField(parts, "  结缘原因: ", relationship.getJoinReason());
        appendField(parts, "  独立目标: ", relationship.getIndependentGoal());
        return String.join("\n", parts);
    }

    public static String renderLocation(Location location) {
        List<String> parts = new ArrayList<>();
        parts.add("### " + location.getName());
        appendField(parts, "类型: ", location.getType());
        appendField(parts, "氛围: ", location.getAtmosphere());
        appendField(parts, "意义: ", location.getSignificance());
        return String.join("\n", parts);
    }

    public static String renderArc(StoryArc arc) {
        List<String> parts = new ArrayList<>();
        parts.add("### 故事弧: " + arc.getName());
        parts.add("类型: " + arc.getType());
        parts.add("状态: " + arc.getStatus());
        List<ArcSection> sections = arc.getSections();
        if (sections != null && !sections.isEmpty()) {
            parts.add("节:");
            for (ArcSection section : sections) {
                parts.add("  - " + section.getName() + " (" + section.getStatus() + ")");
            }
        }
        return String.join("\n", parts);
    }

    public static String renderHintedForeshadowing(Foreshadowing foreshadowing) {
        return "[伏笔提示] " + foreshadowing.getContent() + " (状态: " + foreshadowing.getStatus() + ")";
    }

    public static String renderActiveForeshadowing(Foreshadowing foreshadowing) {
        return "[活跃伏笔] " + foreshadowing.getContent() + " (状态: " + foreshadowing.getStatus() + ")";
    }

    public static String renderHook(Hook hook) {
        String strength = hook.getStrength() != null ? String.valueOf(hook.getStrength()) : "未设定";
        return "[上章钩子] " + hook.getContent() + " (强度: " + strength + ")";
    }

    public static String renderPowerSystem(PowerSystem powerSystem) {
        List<String> parts = new ArrayList<>();
        parts.add("### 力量体系: " + powerSystem.getName());
        if (powerSystem.getLevels() != null && !powerSystem.getLevels().isEmpty()) {
            parts.add("等级: " + String.join(" → ", powerSystem.getLevels()));
        }
        parts.add("核心规则:\n" + bulletList(powerSystem.getCoreRules()));
        if (powerSystem.getConstraints() != null && !powerSystem.getConstraints().isEmpty()) {
            parts.add("限制:\n" + bulletList(powerSystem.getConstraints()));
        }
        return String.join("\n", parts);
    }

    public static String renderSocialRules(Map<String, String> socialRules) {
        List<String> parts = new ArrayList<>();
        parts.add("### 社会规则");
        for (Map.Entry<String, String> rule : socialRules.entrySet()) {
            parts.add("- " + rule.getKey() + ": " + rule.getValue());
        }
        return String.join("\n", parts);
    }

    private static String bulletList(List<String> lines) {
        List<String> bullets = new ArrayList<>(lines.size());
        for (String line : lines) {
            bullets.add("  - " + line);
        }
        return String.join("\n", bullets);
    }

    private static void appendField(List<String> parts, String label, String value) {
        if (StringUtils.isNotBlank(value)) {
            parts.add(label + value);
        }
    }
}
