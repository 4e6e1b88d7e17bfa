package com.inkwell.context;

import com.baomidou.mybatisplus.core.toolkit.Wrappers;
import com.inkwell.domain.entity.Character;
import com.inkwell.domain.entity.Foreshadowing;
import com.inkwell.domain.entity.Location;
import com.inkwell.domain.entity.PowerSystem;
import com.inkwell.domain.entity.Relationship;
import com.inkwell.domain.entity.StoryArc;
import com.inkwell.domain.entity.World;
import com.inkwell.repository.CharacterRepository;
import com.inkwell.repository.ForeshadowingRepository;
import com.inkwell.repository.LocationRepository;
import com.inkwell.repository.RelationshipRepository;
import com.inkwell.repository.StoryArcRepository;
import com.inkwell.repository.WorldRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 全书范围的上下文，不依赖具体章节。
 *
 * buildFull 汇总全部设定（用于设定问答），buildSummary 只给名字和状态（用于头脑风暴）。
 * 两者与章节组装共用同一预算和装箱逻辑。
 */
@Service
public class GlobalContextAssembler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalContextAssembler.class);

    private final CharacterRepository characterRepository;
    private final RelationshipRepository relationshipRepository;
    private final StoryArcRepository storyArcRepository;
    private final LocationRepository locationRepository;
    private final ForeshadowingRepository foreshadowingRepository;
    private final WorldRepository worldRepository;
    private final BudgetFitter budgetFitter;
    private final ContextBudget budget;

    public GlobalContextAssembler(CharacterRepository characterRepository,
                                  RelationshipRepository relationshipRepository,
                                  StoryArcRepository storyArcRepository,
                                  LocationRepository locationRepository,
                                  ForeshadowingRepository foreshadowingRepository,
                                  WorldRepository worldRepository,
                                  BudgetFitter budgetFitter,
                                  ContextBudget budget) {
        this.characterRepository = characterRepository;
        this.relationshipRepository = relationshipRepository;
        this.storyArcRepository = storyArcRepository;
        this.locationRepository = locationRepository;
        this.foreshadowingRepository = foreshadowingRepository;
        this.worldRepository = worldRepository;
        this.budgetFitter = budgetFitter;
        this.budget = budget;
    }

    public BuiltContext buildFull() {
        int fkPriority = budget.priorityOf(ContextTier.L2_FK_EXPANSION);
        List<ContextItem> items = new ArrayList<>();

        List<Character> characters = characterRepository.selectList(Wrappers.<Character>query().orderByAsc("id"));
        if (!characters.isEmpty()) {
            String content = characters.stream().map(c -> {
                List<String> parts = new ArrayList<>();
                parts.add("- " + c.getName() + " (" + c.getRole() + ")");
                if (c.getMotivation() != null && StringUtils.isNotBlank(c.getMotivation().getSurface())) {
                    parts.add("  动机: " + c.getMotivation().getSurface());
                }
                if (c.getFacets() != null && StringUtils.isNotBlank(c.getFacets().getPublicFace())) {
                    parts.add("  性格: " + c.getFacets().getPublicFace());
                }
                return String.join("\n", parts);
            }).collect(Collectors.joining("\n"));
            items.add(item(ContextItemType.CHARACTER, "global-characters", "## 角色\n" + content, fkPriority));
        }

        List<Relationship> relationships = relationshipRepository.selectList(Wrappers.<Relationship>query().orderByAsc("id"));
        if (!relationships.isEmpty()) {
            Map<String, String> names = new HashMap<>();
            for (Character character : characters) {
                names.put(character.getId(), character.getName());
            }
            String content = relationships.stream()
                    .map(r -> "- " + names.getOrDefault(r.getSourceId(), r.getSourceId())
                            + " → " + names.getOrDefault(r.getTargetId(), r.getTargetId())
                            + ": " + r.getType())
                    .collect(Collectors.joining("\n"));
            items.add(item(ContextItemType.RELATIONSHIP, "global-relationships", "## 关系\n" + content, fkPriority));
        }

        List<StoryArc> arcs = storyArcRepository.selectList(Wrappers.<StoryArc>query().orderByAsc("id"));
        if (!arcs.isEmpty()) {
            String content = arcs.stream()
                    .map(a -> "- " + a.getName() + " (" + a.getType() + ", " + a.getStatus() + ")")
                    .collect(Collectors.joining("\n"));
            items.add(item(ContextItemType.ARC, "global-arcs", "## 故事弧\n" + content, fkPriority));
        }

        List<Location> locations = locationRepository.selectList(Wrappers.<Location>query().orderByAsc("id"));
        if (!locations.isEmpty()) {
            String content = locations.stream()
                    .map(l -> "- " + l.getName() + (StringUtils.isNotBlank(l.getType()) ? " (" + l.getType() + ")" : ""))
                    .collect(Collectors.joining("\n"));
            items.add(item(ContextItemType.LOCATION, "global-locations", "## 地点\n" + content, fkPriority));
        }

        List<Foreshadowing> foreshadowing = foreshadowingRepository.selectList(Wrappers.<Foreshadowing>query().orderByAsc("id"));
        if (!foreshadowing.isEmpty()) {
            String content = foreshadowing.stream()
                    .map(f -> "- " + f.getContent() + " (" + f.getStatus() + ")")
                    .collect(Collectors.joining("\n"));
            items.add(item(ContextItemType.FORESHADOWING, "global-foreshadowing", "## 伏笔\n" + content,
                    budget.priorityOf(ContextTier.L3_PLOT_AWARENESS)));
        }

        World world = worldRepository.findFirst();
        int worldPriority = budget.priorityOf(ContextTier.L4_WORLD_RULES);
        if (world != null && world.getPowerSystem() != null) {
            PowerSystem powerSystem = world.getPowerSystem();
            List<String> parts = new ArrayList<>();
            parts.add("## 力量体系: " + powerSystem.getName());
            if (powerSystem.getCoreRules() != null && !powerSystem.getCoreRules().isEmpty()) {
                parts.add("核心规则: " + String.join(", ", powerSystem.getCoreRules()));
            }
            items.add(item(ContextItemType.POWER_SYSTEM, "global-power-system", String.join("\n", parts), worldPriority));
        }
        if (world != null && world.getSocialRules() != null && !world.getSocialRules().isEmpty()) {
            String content = world.getSocialRules().entrySet().stream()
                    .map(e -> "- " + e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining("\n"));
            items.add(item(ContextItemType.SOCIAL_RULES, "global-social-rules", "## 社会规则\n" + content, worldPriority));
        }

        BuiltContext result = budgetFitter.fit(items, budget.getAvailableTokens());
        logger.info("🌐 全局上下文组装完成: 条目={}, tokens={}, truncated={}",
                result.getItems().size(), result.getTotalTokens(), result.isTruncated());
        return result;
    }

    public BuiltContext buildSummary() {
        int fkPriority = budget.priorityOf(ContextTier.L2_FK_EXPANSION);
        List<ContextItem> items = new ArrayList<>();

        List<Character> characters = characterRepository.selectList(Wrappers.<Character>query().orderByAsc("id"));
        if (!characters.isEmpty()) {
            items.add(item(ContextItemType.CHARACTER, "summary-characters",
                    "角色: " + characters.stream().map(c -> c.getName() + "(" + c.getRole() + ")")
                            .collect(Collectors.joining(", ")),
                    fkPriority));
        }

        List<StoryArc> arcs = storyArcRepository.selectList(Wrappers.<StoryArc>query().orderByAsc("id"));
        if (!arcs.isEmpty()) {
            items.add(item(ContextItemType.ARC, "summary-arcs",
                    "故事弧: " + arcs.stream().map(a -> a.getName() + "(" + a.getStatus() + ")")
                            .collect(Collectors.joining(", ")),
                    fkPriority));
        }

        List<Foreshadowing> active = foreshadowingRepository.findActive();
        if (!active.isEmpty()) {
            items.add(item(ContextItemType.FORESHADOWING, "summary-foreshadowing",
                    "活跃伏笔: " + active.stream().map(Foreshadowing::getContent).collect(Collectors.joining("; ")),
                    budget.priorityOf(ContextTier.L3_PLOT_AWARENESS)));
        }

        BuiltContext result = budgetFitter.fit(items, budget.getAvailableTokens());
        logger.info("🌐 全局摘要组装完成: 条目={}, tokens={}", result.getItems().size(), result.getTotalTokens());
        return result;
    }

    private static ContextItem item(ContextItemType type, String id, String content, int priority) {
        return ContextItem.builder().type(type).id(id).content(content).priority(priority).build();
    }
}
