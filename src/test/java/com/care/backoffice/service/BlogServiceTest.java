package com.care.backoffice.service;

import com.care.backoffice.dto.BlogRequest;
import com.care.backoffice.entity.Blog;
import com.care.backoffice.exception.ConflictException;
import com.care.backoffice.exception.ConflictTranslator;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.storage.StorageBackend;
import com.care.backoffice.support.DatabaseCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@SpringBootTest
class BlogServiceTest {

    @Autowired
    private BlogService blogService;
    @Autowired
    private ConflictTranslator conflictTranslator;
    @Autowired
    private JdbcTemplate jdbc;

    @MockBean
    private StorageBackend storage;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.clean(jdbc);
    }

    @Test
    void slugIsDerivedFromTitle() {
        assertEquals("cafe-health-tips", BlogService.slugify("  Café & Health Tips! "));
        assertThrows(ValidationException.class, () -> BlogService.slugify("!!!"));
    }

    @Test
    void createUsesDerivedSlugWhenOmitted() {
        Blog blog = blogService.create(BlogRequest.builder().title("Caring for Braces").build());

        assertEquals("caring-for-braces", blog.getSlug());
        assertFalse(blog.isPublished());
    }

    @Test
    void duplicateSlugTranslatesToConflict() {
        blogService.create(BlogRequest.builder().title("Caring for Braces").build());

        DataIntegrityViolationException ex = assertThrows(DataIntegrityViolationException.class, () ->
                blogService.create(BlogRequest.builder().title("Another").slug("caring-for-braces").build()));

        ConflictException conflict = assertInstanceOf(ConflictException.class, conflictTranslator.translate(ex));
        assertEquals("slug", conflict.getField());
        assertEquals("Slug already in use.", conflict.getMessage());
    }

    @Test
    void removeImageClearsUrlAndDeletesStoredFile() {
        Blog blog = blogService.create(BlogRequest.builder()
                .title("Whitening")
                .imageUrl(Optional.of("/uploads/whitening.jpg"))
                .build());

        Blog updated = blogService.update(blog.getId(), BlogRequest.builder().removeImage(true).build());

        assertNull(updated.getImageUrl());
        verify(storage).delete("/uploads/whitening.jpg");
    }

    @Test
    void deleteSurvivesStorageFailure() {
        Blog blog = blogService.create(BlogRequest.builder()
                .title("Whitening")
                .imageUrl(Optional.of("/uploads/whitening.jpg"))
                .build());
        when(storage.delete(anyString())).thenThrow(new IllegalStateException("disk gone"));

        blogService.delete(blog.getId());

        assertTrue(blogService.list(null).isEmpty());
    }
}
