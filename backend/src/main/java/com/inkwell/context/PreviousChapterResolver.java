package com.inkwell.context;

import com.inkwell.domain.entity.Chapter;
import com.inkwell.repository.ChapterRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * 查找紧邻的前一章。
 *
 * 有卷时在同卷内按排序键找，没有卷时在全部章节里找；列表查询只带元数据，
 * 命中后再按主键取回带正文的记录。
 */
@Component
public class PreviousChapterResolver {

    private final ChapterRepository chapterRepository;

    public PreviousChapterResolver(ChapterRepository chapterRepository) {
        this.chapterRepository = chapterRepository;
    }

    public Chapter resolve(Chapter chapter) {
        List<Chapter> siblings = chapter.getVolumeId() != null
                ? chapterRepository.findByVolumeId(chapter.getVolumeId())
                : chapterRepository.findAllOrdered();

        int index = -1;
        for (int i = 0; i < siblings.size(); i++) {
            if (Objects.equals(siblings.get(i).getId(), chapter.getId())) {
                index = i;
                break;
            }
        }
        if (index <= 0) {
            return null;
        }

        return chapterRepository.selectById(siblings.get(index - 1).getId());
    }
}
