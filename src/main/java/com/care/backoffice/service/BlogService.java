package com.care.backoffice.service;

import com.care.backoffice.dto.BlogRequest;
import com.care.backoffice.entity.Blog;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.repository.BlogRepository;
import com.care.backoffice.storage.StorageBackend;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class BlogService {

    private static final Logger log = LoggerFactory.getLogger(BlogService.class);

    private final BlogRepository blogRepository;
    private final StorageBackend storage;

    @Transactional(readOnly = true)
    public List<Blog> list(String query) {
        String q = StringUtils.trimToNull(query);
        return q == null ? blogRepository.findAllByOrderByCreatedAtDesc() : blogRepository.search(q);
    }

    @Transactional(readOnly = true)
    public Blog get(Long id) {
        return load(id);
    }

    @Transactional
    public Blog create(BlogRequest request) {
        if (StringUtils.isBlank(request.getTitle())) {
            throw ValidationException.of("title", "Title is required");
        }
        String title = request.getTitle().trim();
        String slug = StringUtils.isBlank(request.getSlug()) ? slugify(title) : slugify(request.getSlug());
        Blog blog = Blog.builder()
                .title(title)
                .slug(slug)
                .excerpt(request.getExcerpt() != null ? StringUtils.trimToNull(request.getExcerpt().orElse(null)) : null)
                .content(request.getContent() != null ? request.getContent().orElse(null) : null)
                .published(request.getPublished() != null && request.getPublished())
                .imageUrl(request.getImageUrl() != null ? StringUtils.trimToNull(request.getImageUrl().orElse(null)) : null)
                .build();
        blog = blogRepository.saveAndFlush(blog);
        log.info("Created blog {} ({})", blog.getId(), blog.getSlug());
        return blog;
    }

    @Transactional
    public Blog update(Long id, BlogRequest request) {
        Blog blog = load(id);
        String previousImage = blog.getImageUrl();

        if (request.getTitle() != null) blog.setTitle(request.getTitle().trim());
        if (StringUtils.isNotBlank(request.getSlug())) blog.setSlug(slugify(request.getSlug()));
        if (request.getExcerpt() != null) blog.setExcerpt(StringUtils.trimToNull(request.getExcerpt().orElse(null)));
        if (request.getContent() != null) blog.setContent(request.getContent().orElse(null));
        if (request.getPublished() != null) blog.setPublished(request.getPublished());
        if (Boolean.TRUE.equals(request.getRemoveImage())) blog.setImageUrl(null);
        if (request.getImageUrl() != null) blog.setImageUrl(StringUtils.trimToNull(request.getImageUrl().orElse(null)));

        blog = blogRepository.saveAndFlush(blog);
        log.info("Updated blog {}", id);
        if (previousImage != null && !previousImage.equals(blog.getImageUrl())) {
            discardImage(previousImage);
        }
        return blog;
    }

    @Transactional
    public void delete(Long id) {
        Blog blog = load(id);
        blogRepository.delete(blog);
        blogRepository.flush();
        log.info("Deleted blog {}", id);
        if (blog.getImageUrl() != null) {
            discardImage(blog.getImageUrl());
        }
    }

    /**
     * Lower-case ASCII words joined by single dashes, e.g.
     * {@code "Café & Health Tips!"} becomes {@code "cafe-health-tips"}.
     */
    static String slugify(String text) {
        String slug = StringUtils.stripAccents(text).toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (slug.isEmpty()) {
            throw ValidationException.of("slug", "Slug must contain letters or digits");
        }
        return slug;
    }

    // the post is already gone; a stale file is only logged
    private void discardImage(String url) {
        try {
            storage.delete(url);
        } catch (RuntimeException e) {
            log.warn("Could not delete stored image {}: {}", url, e.getMessage());
        }
    }

    private Blog load(Long id) {
        return blogRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("blog", id));
    }
}
