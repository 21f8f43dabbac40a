package com.care.backoffice.repository;

import com.care.backoffice.entity.PatientServiceUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PatientServiceUsageRepository extends JpaRepository<PatientServiceUsage, Long> {

    @Query("SELECT u FROM PatientServiceUsage u JOIN FETCH u.service WHERE u.patient.id = :patientId ORDER BY u.usedAt DESC, u.id DESC")
    List<PatientServiceUsage> findByPatientIdWithService(@Param("patientId") Long patientId);

    @Query("SELECT u FROM PatientServiceUsage u JOIN FETCH u.service JOIN FETCH u.patient ORDER BY u.usedAt DESC, u.id DESC")
    List<PatientServiceUsage> findAllWithService();

    @Query("SELECT u.service.id FROM PatientServiceUsage u WHERE u.patient.id = :patientId")
    List<Long> findServiceIdsByPatientId(@Param("patientId") Long patientId);

    @Modifying
    @Query("DELETE FROM PatientServiceUsage u WHERE u.patient.id = :patientId AND u.service.id IN :serviceIds")
    int deleteByPatientIdAndServiceIdIn(@Param("patientId") Long patientId, @Param("serviceIds") Collection<Long> serviceIds);

    @Modifying
    @Query("DELETE FROM PatientServiceUsage u WHERE u.patient.id = :patientId")
    int deleteByPatientId(@Param("patientId") Long patientId);

    @Modifying
    @Query("DELETE FROM PatientServiceUsage u WHERE u.service.id = :serviceId")
    int deleteByServiceId(@Param("serviceId") Long serviceId);
}
