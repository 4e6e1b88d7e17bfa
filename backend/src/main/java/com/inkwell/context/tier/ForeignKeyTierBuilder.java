package com.inkwell.context.tier;

import com.inkwell.context.ContextBudget;
import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextItemType;
import com.inkwell.context.ContextTextRenderer;
import com.inkwell.context.ContextTier;
import com.inkwell.context.EntityLookups;
import com.inkwell.domain.entity.Chapter;
import com.inkwell.domain.entity.Character;
import com.inkwell.domain.entity.Location;
import com.inkwell.domain.entity.Relationship;
import com.inkwell.domain.entity.StoryArc;
import com.inkwell.repository.CharacterRepository;
import com.inkwell.repository.LocationRepository;
import com.inkwell.repository.RelationshipRepository;
import com.inkwell.repository.StoryArcRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * L2 外键展开层：角色、限定范围的关系、地点、故事弧
 */
@Component
@Order(2)
public class ForeignKeyTierBuilder implements ContextTierBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ForeignKeyTierBuilder.class);

    private final CharacterRepository characterRepository;
    private final RelationshipRepository relationshipRepository;
    private final LocationRepository locationRepository;
    private final StoryArcRepository storyArcRepository;
    private final ContextBudget budget;

    public ForeignKeyTierBuilder(CharacterRepository characterRepository,
                                 RelationshipRepository relationshipRepository,
                                 LocationRepository locationRepository,
                                 StoryArcRepository storyArcRepository,
                                 ContextBudget budget) {
        this.characterRepository = characterRepository;
        this.relationshipRepository = relationshipRepository;
        this.locationRepository = locationRepository;
        this.storyArcRepository = storyArcRepository;
        this.budget = budget;
    }

    @Override
    public ContextTier tier() {
        return ContextTier.L2_FK_EXPANSION;
    }

    @Override
    public List<ContextItem> build(ChapterScope scope) {
        int priority = budget.priorityOf(tier());
        Chapter chapter = scope.getChapter();
        List<ContextItem> items = new ArrayList<>();

        List<String> characterIds = EntityLookups.distinctIds(chapter.getCharacters());
        if (!characterIds.isEmpty()) {
            List<Character> characters = EntityLookups.inRequestedOrder(characterIds,
                    characterRepository.selectBatchIds(characterIds), Character::getId);
            logDangling("角色", characterIds.size(), characters.size(), chapter.getId());

            Map<String, String> names = new HashMap<>();
            for (Character character : characters) {
                names.put(character.getId(), character.getName());
                items.add(item(ContextItemType.CHARACTER, character.getId(),
                        ContextTextRenderer.renderCharacter(character), priority));
            }

            for (Relationship relationship : findScopedRelationships(characterIds)) {
                String sourceName = names.getOrDefault(relationship.getSourceId(), relationship.getSourceId());
                String targetName = names.getOrDefault(relationship.getTargetId(), relationship.getTargetId());
                items.add(item(ContextItemType.RELATIONSHIP, "rel-" + relationship.getId(),
                        ContextTextRenderer.renderRelationship(relationship, sourceName, targetName), priority));
            }
        }

        List<String> locationIds = EntityLookups.distinctIds(chapter.getLocations());
        if (!locationIds.isEmpty()) {
            List<Location> locations = EntityLookups.inRequestedOrder(locationIds,
                    locationRepository.selectBatchIds(locationIds), Location::getId);
            logDangling("地点", locationIds.size(), locations.size(), chapter.getId());
            for (Location location : locations) {
                items.add(item(ContextItemType.LOCATION, location.getId(),
                        ContextTextRenderer.renderLocation(location), priority));
            }
        }

        if (StringUtils.isNotBlank(chapter.getArcId())) {
            StoryArc arc = storyArcRepository.selectById(chapter.getArcId());
            if (arc != null) {
                items.add(item(ContextItemType.ARC, arc.getId(), ContextTextRenderer.renderArc(arc), priority));
            }
        }

        return items;
    }

    /**
     * 只取两端都在本章出场名单里的关系；每对角色正反各查一次，按关系 id 去重
     */
    List<Relationship> findScopedRelationships(List<String> characterIds) {
        List<Relationship> relationships = new ArrayList<>();
        Set<Long> seen = new HashSet<>();

        for (int i = 0; i < characterIds.size(); i++) {
            for (int j = i + 1; j < characterIds.size(); j++) {
                String idA = characterIds.get(i);
                String idB = characterIds.get(j);

                Relationship forward = relationshipRepository.findBetween(idA, idB);
                if (forward != null && seen.add(forward.getId())) {
                    relationships.add(forward);
                }

                Relationship reverse = relationshipRepository.findBetween(idB, idA);
                if (reverse != null && seen.add(reverse.getId())) {
                    relationships.add(reverse);
                }
            }
        }

        return relationships;
    }

    private void logDangling(String kind, int requested, int found, Long chapterId) {
        if (found < requested) {
            logger.debug("章节{}引用的{}有{}个已不存在，忽略", chapterId, kind, requested - found);
        }
    }

    private static ContextItem item(ContextItemType type, String id, String content, int priority) {
        return ContextItem.builder().type(type).id(id).content(content).priority(priority).build();
    }
}
