package com.care.backoffice.repository;

import com.care.backoffice.entity.SpecialtyClinic;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SpecialtyClinicRepository extends JpaRepository<SpecialtyClinic, Long> {

    List<SpecialtyClinic> findAllByOrderByCreatedAtDesc();
}
