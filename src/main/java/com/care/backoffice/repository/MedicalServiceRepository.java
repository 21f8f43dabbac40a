package com.care.backoffice.repository;

import com.care.backoffice.entity.MedicalService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface MedicalServiceRepository extends JpaRepository<MedicalService, Long> {

    @Query("SELECT s FROM MedicalService s ORDER BY CASE WHEN s.priority IS NULL THEN 1 ELSE 0 END, s.priority ASC, s.createdAt DESC")
    List<MedicalService> findAllOrdered();

    @Query("SELECT s FROM MedicalService s WHERE lower(s.name) LIKE lower(concat('%', :q, '%')) "
            + "OR lower(s.description) LIKE lower(concat('%', :q, '%')) "
            + "OR lower(s.shortDescription) LIKE lower(concat('%', :q, '%')) "
            + "ORDER BY CASE WHEN s.priority IS NULL THEN 1 ELSE 0 END, s.priority ASC, s.createdAt DESC")
    List<MedicalService> search(@Param("q") String q);

    List<MedicalService> findByParentIdOrderByNameAsc(Long parentId);

    long countByIdIn(Collection<Long> ids);

    @Modifying
    @Query("UPDATE MedicalService s SET s.parent = null WHERE s.parent.id = :parentId")
    int detachChildren(@Param("parentId") Long parentId);
}
