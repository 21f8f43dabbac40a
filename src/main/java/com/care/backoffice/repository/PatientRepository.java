package com.care.backoffice.repository;

import com.care.backoffice.entity.Patient;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PatientRepository extends JpaRepository<Patient, Long> {

    Optional<Patient> findByEmail(String email);

    List<Patient> findAllByOrderByCreatedAtDesc();

    List<Patient> findTop5ByOrderByCreatedAtDesc();

    long countByCreatedAtAfter(Instant since);

    Optional<Patient> findByPhone(String phone);
}
