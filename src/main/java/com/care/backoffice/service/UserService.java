package com.care.backoffice.service;

import com.care.backoffice.dto.UserCreateRequest;
import com.care.backoffice.dto.UserUpdateRequest;
import com.care.backoffice.dto.UserView;
import com.care.backoffice.entity.Role;
import com.care.backoffice.entity.StaffUser;
import com.care.backoffice.exception.ConflictException;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.repository.AppointmentRepository;
import com.care.backoffice.repository.StaffUserRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Back-office accounts. Password hashes never leave this class; there is always
 * at least one {@link Role#ADMIN}.
 */
@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final String LAST_ADMIN_MSG = "At least one admin account must remain.";

    private final StaffUserRepository userRepository;
    private final AppointmentRepository appointmentRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional(readOnly = true)
    public List<UserView> list() {
        return userRepository.findAllByOrderByCreatedAtDesc().stream().map(UserView::from).toList();
    }

    @Transactional(readOnly = true)
    public UserView get(Long id) {
        return UserView.from(load(id));
    }

    @Transactional
    public UserView create(UserCreateRequest request) {
        StaffUser user = StaffUser.builder()
                .email(normalizeEmail(request.getEmail()))
                .name(StringUtils.trimToNull(request.getName()))
                .role(request.getRole() != null ? request.getRole() : Role.STAFF)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .build();
        user = userRepository.saveAndFlush(user);
        log.info("Created {} user {} ({})", user.getRole(), user.getId(), user.getEmail());
        return UserView.from(user);
    }

    @Transactional
    public UserView update(Long id, UserUpdateRequest request) {
        StaffUser user = load(id);

        if (request.getRole() != null && request.getRole() != user.getRole()) {
            if (user.getRole() == Role.ADMIN) {
                requireAnotherAdmin();
            }
            log.info("User {} role {} -> {}", id, user.getRole(), request.getRole());
            user.setRole(request.getRole());
        }
        if (StringUtils.isNotBlank(request.getEmail())) user.setEmail(normalizeEmail(request.getEmail()));
        if (request.getName() != null) user.setName(StringUtils.trimToNull(request.getName().orElse(null)));
        if (StringUtils.isNotEmpty(request.getPassword())) {
            user.setPasswordHash(passwordEncoder.encode(request.getPassword()));
            log.info("Password changed for user {}", id);
        }

        user = userRepository.saveAndFlush(user);
        return UserView.from(user);
    }

    /** Appointments assigned to the user stay, unassigned. */
    @Transactional
    public void delete(Long id) {
        StaffUser user = load(id);
        if (user.getRole() == Role.ADMIN) {
            requireAnotherAdmin();
        }
        int unassigned = appointmentRepository.unassignStaff(id);
        userRepository.delete(user);
        log.info("Deleted user {} ({} appointments unassigned)", id, unassigned);
    }

    private void requireAnotherAdmin() {
        if (userRepository.countByRole(Role.ADMIN) <= 1) {
            throw new ConflictException("role", LAST_ADMIN_MSG);
        }
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private StaffUser load(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("user", id));
    }
}
