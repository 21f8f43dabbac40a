package com.care.backoffice.repository;

import com.care.backoffice.entity.Blog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface BlogRepository extends JpaRepository<Blog, Long> {

    List<Blog> findAllByOrderByCreatedAtDesc();

    @Query("SELECT b FROM Blog b WHERE lower(b.title) LIKE lower(concat('%', :q, '%')) "
            + "OR lower(b.content) LIKE lower(concat('%', :q, '%')) ORDER BY b.createdAt DESC")
    List<Blog> search(@Param("q") String q);
}
