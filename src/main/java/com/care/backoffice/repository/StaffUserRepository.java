package com.care.backoffice.repository;

import com.care.backoffice.entity.Role;
import com.care.backoffice.entity.StaffUser;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StaffUserRepository extends JpaRepository<StaffUser, Long> {

    Optional<StaffUser> findByEmailIgnoreCase(String email);

    List<StaffUser> findAllByOrderByCreatedAtDesc();

    long countByRole(Role role);
}
