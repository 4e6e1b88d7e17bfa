package com.inkwell.context;

import com.inkwell.domain.entity.Chapter;
import com.inkwell.repository.ChapterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PreviousChapterResolverTest {

    @Mock
    private ChapterRepository chapterRepository;

    private PreviousChapterResolver resolver;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        resolver = new PreviousChapterResolver(chapterRepository);
    }

    @Test
    void shouldResolveWithinVolumeBySortOrder() {
        Chapter first = chapter(7L, 3L);
        Chapter second = chapter(4L, 3L);
        Chapter withContent = chapter(7L, 3L);
        withContent.setContent("full text");
        when(chapterRepository.findByVolumeId(3L)).thenReturn(Arrays.asList(first, second));
        when(chapterRepository.selectById(7L)).thenReturn(withContent);

        assertSame(withContent, resolver.resolve(second));
        verify(chapterRepository, never()).findAllOrdered();
    }

    @Test
    void shouldFallBackToAllChaptersWithoutVolume() {
        Chapter first = chapter(1L, null);
        Chapter second = chapter(2L, null);
        when(chapterRepository.findAllOrdered()).thenReturn(Arrays.asList(first, second));
        when(chapterRepository.selectById(1L)).thenReturn(first);

        assertSame(first, resolver.resolve(second));
        verify(chapterRepository, never()).findByVolumeId(any());
    }

    @Test
    void shouldReturnNullForFirstChapter() {
        Chapter first = chapter(1L, 3L);
        when(chapterRepository.findByVolumeId(3L)).thenReturn(Arrays.asList(first, chapter(2L, 3L)));

        assertNull(resolver.resolve(first));
        verify(chapterRepository, never()).selectById(any());
    }

    @Test
    void shouldReturnNullWhenChapterIsMissingFromListing() {
        when(chapterRepository.findAllOrdered()).thenReturn(Collections.singletonList(chapter(1L, null)));

        assertNull(resolver.resolve(chapter(5L, null)));
    }

    private static Chapter chapter(Long id, Long volumeId) {
        Chapter chapter = new Chapter();
        chapter.setId(id);
        chapter.setVolumeId(volumeId);
        return chapter;
    }
}
