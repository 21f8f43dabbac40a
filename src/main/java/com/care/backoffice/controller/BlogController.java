package com.care.backoffice.controller;

import com.care.backoffice.dto.BlogRequest;
import com.care.backoffice.entity.Blog;
import com.care.backoffice.service.BlogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/blogs")
public class BlogController {

    private final BlogService blogService;

    public BlogController(BlogService blogService) {
        this.blogService = blogService;
    }

    @GetMapping
    public List<Blog> list(@RequestParam(required = false) String q) {
        return blogService.list(q);
    }

    @PostMapping
    public ResponseEntity<Blog> create(@Valid @RequestBody BlogRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(blogService.create(body));
    }

    @GetMapping("/{id}")
    public Blog get(@PathVariable Long id) {
        return blogService.get(id);
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public Blog update(@PathVariable Long id, @Valid @RequestBody BlogRequest body) {
        return blogService.update(id, body);
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable Long id) {
        blogService.delete(id);
        return Map.of("ok", true);
    }
}
