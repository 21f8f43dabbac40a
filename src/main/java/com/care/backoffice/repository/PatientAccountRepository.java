package com.care.backoffice.repository;

import com.care.backoffice.entity.PatientAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PatientAccountRepository extends JpaRepository<PatientAccount, Long> {

    Optional<PatientAccount> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByPatientId(Long patientId);

    @Modifying
    @Query("DELETE FROM PatientAccount a WHERE a.patient.id = :patientId")
    int deleteByPatientId(@Param("patientId") Long patientId);
}
