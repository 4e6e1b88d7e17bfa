package com.inkwell.context;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 把入选条目按语义分组渲染成一段结构化文本，直接注入提示词。
 * 分组顺序固定，与条目优先级无关；空分组不输出标题。
 */
@Component
public class ContextFormatter {

    static final String OPEN_TAG = "<context>";
    static final String CLOSE_TAG = "</context>";

    public String formatContext(List<ContextItem> items) {
        Map<ContextSection, List<String>> grouped = new EnumMap<>(ContextSection.class);
        if (items != null) {
            for (ContextItem item : items) {
                if (item == null || item.getType() == null) {
                    continue;
                }
                grouped.computeIfAbsent(item.getType().getSection(), section -> new ArrayList<>())
                        .add(item.getContent() == null ? "" : item.getContent());
            }
        }

        List<String> sections = new ArrayList<>();
        for (Map.Entry<ContextSection, List<String>> group : grouped.entrySet()) {
            sections.add(group.getKey().getHeading() + "\n" + String.join("\n\n", group.getValue()));
        }

        return OPEN_TAG + "\n" + String.join("\n\n", sections) + "\n" + CLOSE_TAG;
    }
}
