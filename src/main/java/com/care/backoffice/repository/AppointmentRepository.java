package com.care.backoffice.repository;

import com.care.backoffice.entity.Appointment;
import com.care.backoffice.entity.AppointmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface AppointmentRepository extends JpaRepository<Appointment, Long>, JpaSpecificationExecutor<Appointment> {

    long countByDateGreaterThanEqualAndStatus(Instant from, AppointmentStatus status);

    List<Appointment> findTop6ByOrderByDateDesc();

    long countByServiceId(Long serviceId);

    long countByPatientId(Long patientId);

    @Modifying
    @Query("UPDATE Appointment a SET a.staff = null WHERE a.staff.id = :staffId")
    int unassignStaff(@Param("staffId") Long staffId);
}
