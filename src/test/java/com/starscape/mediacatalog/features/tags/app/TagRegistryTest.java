package com.starscape.mediacatalog.features.tags.app;

import com.starscape.mediacatalog.TestFixtures;
import com.starscape.mediacatalog.common.exception.BusinessException;
import com.starscape.mediacatalog.common.exception.ConflictException;
import com.starscape.mediacatalog.common.exception.ErrorCode;
import com.starscape.mediacatalog.common.exception.NotFoundException;
import com.starscape.mediacatalog.common.exception.ReferenceException;
import com.starscape.mediacatalog.common.exception.StateException;
import com.starscape.mediacatalog.common.exception.ValidationException;
import com.starscape.mediacatalog.features.categories.domain.Category;
import com.starscape.mediacatalog.features.categories.domain.CategoryLookup;
import com.starscape.mediacatalog.features.media.domain.MediaTagRepository;
import com.starscape.mediacatalog.features.tags.domain.NewTag;
import com.starscape.mediacatalog.features.tags.domain.Tag;
import com.starscape.mediacatalog.features.tags.domain.TagRepository;
import com.starscape.mediacatalog.features.tags.domain.TagUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TagRegistryTest {

    @Mock
    private TagRepository tagRepository;

    @Mock
    private MediaTagRepository mediaTagRepository;

    @Mock
    private CategoryLookup categories;

    private TagRegistry registry;
    private Category people;
    private Category places;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new TagRegistry(
            tagRepository, mediaTagRepository, categories, TestFixtures.defaultProperties()
        );
        people = TestFixtures.category(1, "People");
        places = TestFixtures.category(2, "Places");
        when(categories.get(1)).thenReturn(people);
        when(categories.get(2)).thenReturn(places);
        when(categories.get(99)).thenThrow(new NotFoundException("Category not found: 99"));
    }

    @Test
    void testCreate_Success() {
        when(tagRepository.saveAndFlush(any(Tag.class)))
            .thenAnswer(invocation -> TestFixtures.withId(invocation.getArgument(0), 10));

        Tag created = registry.create(new NewTag(" Alice ", 1, null));

        assertEquals(10, created.getId());
        assertEquals("Alice", created.getName());
        assertEquals(1, created.getCategoryId());
        assertEquals("", created.getDescription());
    }

    @Test
    void testCreate_InvalidCategoryId() {
        BusinessException ex = assertThrows(ValidationException.class, () -> registry.create(new NewTag("Alice", 0, "")));

        assertEquals(ErrorCode.INVALID_CATEGORY_ID, ex.getCode());
        verifyNoInteractions(categories);
    }

    @Test
    void testCreate_CategoryNotFound() {
        ReferenceException ex = assertThrows(ReferenceException.class, () -> registry.create(new NewTag("Alice", 99, "")));

        assertEquals(ErrorCode.CATEGORY_NOT_FOUND, ex.getCode());
        assertEquals(ErrorCode.NOT_FOUND, ex.getReferenceCode());
        verify(tagRepository, never()).saveAndFlush(any());
    }

    @Test
    void testCreate_EmptyName() {
        BusinessException ex = assertThrows(ValidationException.class, () -> registry.create(new NewTag(" ", 1, "")));

        assertEquals(ErrorCode.INVALID_NAME, ex.getCode());
    }

    @Test
    void testCreate_NameTooLong() {
        BusinessException ex = assertThrows(ValidationException.class,
            () -> registry.create(new NewTag("t".repeat(51), 1, "")));

        assertEquals(ErrorCode.NAME_TOO_LONG, ex.getCode());
    }

    @Test
    void testCreate_DescriptionTooLong() {
        BusinessException ex = assertThrows(ValidationException.class,
            () -> registry.create(new NewTag("Alice", 1, "d".repeat(301))));

        assertEquals(ErrorCode.DESCRIPTION_TOO_LONG, ex.getCode());
    }

    @Test
    void testCreate_DuplicateInCategory() {
        when(tagRepository.existsByNameAndCategoryId("Alice", 1)).thenReturn(true);

        BusinessException ex = assertThrows(ConflictException.class, () -> registry.create(new NewTag("Alice", 1, "")));

        assertEquals(ErrorCode.ALREADY_EXISTS, ex.getCode());
        verify(tagRepository, never()).saveAndFlush(any());
    }

    @Test
    void testCreate_SameNameInOtherCategoryIsAllowed() {
        when(tagRepository.existsByNameAndCategoryId("Alice", 1)).thenReturn(true);
        when(tagRepository.saveAndFlush(any(Tag.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Tag created = registry.create(new NewTag("Alice", 2, ""));

        assertEquals(2, created.getCategoryId());
    }

    @Test
    void testCreate_UniqueConstraintViolation() {
        when(tagRepository.saveAndFlush(any(Tag.class)))
            .thenThrow(TestFixtures.uniqueViolation("tags_name_category_unique"));

        BusinessException ex = assertThrows(ConflictException.class, () -> registry.create(new NewTag("Alice", 1, "")));

        assertEquals(ErrorCode.ALREADY_EXISTS, ex.getCode());
    }

    @Test
    void testCreate_OtherIntegrityViolationIsNotAConflict() {
        when(tagRepository.saveAndFlush(any(Tag.class)))
            .thenThrow(TestFixtures.integrityViolation("tags_description", "22001"));

        assertThrows(DataIntegrityViolationException.class, () -> registry.create(new NewTag("Alice", 1, "")));
    }

    @Test
    void testCreate_LongMultiCodePointTextWithinLimits() {
        when(tagRepository.saveAndFlush(any(Tag.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Tag created = registry.create(new NewTag(TestFixtures.markedText(50), 1, TestFixtures.markedText(300)));

        assertEquals(400, created.getName().length());
        assertEquals(2400, created.getDescription().length());
    }

    @Test
    void testUpdate_EmptyPatchDoesNotCollideWithItself() {
        Tag tag = TestFixtures.tag(10, "Alice", people);
        when(tagRepository.findById(10)).thenReturn(Optional.of(tag));
        when(tagRepository.existsByNameAndCategoryId("Alice", 1)).thenReturn(true);
        when(tagRepository.existsByNameAndCategoryIdAndIdNot("Alice", 1, 10)).thenReturn(false);

        registry.update(10, TagUpdate.empty());

        verify(tagRepository).saveAndFlush(tag);
    }

    @Test
    void testUpdate_MoveToOtherCategory() {
        Tag tag = TestFixtures.tag(10, "Alice", people);
        when(tagRepository.findById(10)).thenReturn(Optional.of(tag));

        registry.update(10, new TagUpdate(null, 2, "friend"));

        assertEquals("Alice", tag.getName());
        assertEquals(2, tag.getCategoryId());
        assertEquals("friend", tag.getDescription());
    }

    @Test
    void testUpdate_RenameCollides() {
        Tag tag = TestFixtures.tag(10, "Alice", people);
        when(tagRepository.findById(10)).thenReturn(Optional.of(tag));
        when(tagRepository.existsByNameAndCategoryIdAndIdNot("Bob", 1, 10)).thenReturn(true);

        BusinessException ex = assertThrows(ConflictException.class,
            () -> registry.update(10, new TagUpdate("Bob", null, null)));

        assertEquals(ErrorCode.ALREADY_EXISTS, ex.getCode());
        assertEquals("Alice", tag.getName());
        verify(tagRepository, never()).saveAndFlush(any());
    }

    @Test
    void testUpdate_UnknownCategory() {
        Tag tag = TestFixtures.tag(10, "Alice", people);
        when(tagRepository.findById(10)).thenReturn(Optional.of(tag));

        BusinessException ex = assertThrows(ReferenceException.class,
            () -> registry.update(10, new TagUpdate(null, 99, null)));

        assertEquals(ErrorCode.CATEGORY_NOT_FOUND, ex.getCode());
        assertEquals(1, tag.getCategoryId());
    }

    @Test
    void testGet_NotFound() {
        when(tagRepository.findById(10)).thenReturn(Optional.empty());

        BusinessException ex = assertThrows(NotFoundException.class, () -> registry.get(10));

        assertEquals(ErrorCode.NOT_FOUND, ex.getCode());
    }

    @Test
    void testList_AllOrByCategory() {
        Tag alice = TestFixtures.tag(10, "Alice", people);
        Tag paris = TestFixtures.tag(11, "Paris", places);
        when(tagRepository.findAllByOrderByNameAscIdAsc()).thenReturn(List.of(alice, paris));
        when(tagRepository.findByCategoryIdOrderByNameAscIdAsc(2)).thenReturn(List.of(paris));

        assertEquals(List.of(alice, paris), registry.list(null));
        assertEquals(List.of(paris), registry.list(2));
    }

    @Test
    void testList_UnknownCategory() {
        assertThrows(ReferenceException.class, () -> registry.list(99));
        verify(tagRepository, never()).findByCategoryIdOrderByNameAscIdAsc(anyInt());
    }

    @Test
    void testSearchByName_TooShort() {
        BusinessException ex = assertThrows(ValidationException.class, () -> registry.searchByName("al"));

        assertEquals(ErrorCode.INVALID_NAME, ex.getCode());
        verify(tagRepository, never()).findAllByOrderByNameAscIdAsc();
    }

    @Test
    void testSearchByName_MatchesPrefixIgnoringCase() {
        Tag alice = TestFixtures.tag(10, "Alice", people);
        Tag alina = TestFixtures.tag(12, "ALINA", people);
        Tag paris = TestFixtures.tag(11, "Paris", places);
        when(tagRepository.findAllByOrderByNameAscIdAsc()).thenReturn(List.of(alina, alice, paris));

        assertEquals(List.of(alina, alice), registry.searchByName("ali"));
    }

    @Test
    void testDelete_InUse() {
        when(tagRepository.findById(10)).thenReturn(Optional.of(TestFixtures.tag(10, "Alice", people)));
        when(mediaTagRepository.countByTagId(10)).thenReturn(1L);

        BusinessException ex = assertThrows(StateException.class, () -> registry.delete(10));

        assertEquals(ErrorCode.IN_USE, ex.getCode());
        verify(tagRepository, never()).delete(any());
    }

    @Test
    void testDelete_Unused() {
        Tag tag = TestFixtures.tag(10, "Alice", people);
        when(tagRepository.findById(10)).thenReturn(Optional.of(tag));

        registry.delete(10);

        verify(tagRepository).delete(tag);
        verify(tagRepository).flush();
        verify(tagRepository, never()).existsByNameAndCategoryId(anyString(), anyInt());
    }
}
