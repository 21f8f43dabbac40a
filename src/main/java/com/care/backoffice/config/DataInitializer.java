package com.care.backoffice.config;

import com.care.backoffice.entity.Role;
import com.care.backoffice.entity.StaffUser;
import com.care.backoffice.repository.StaffUserRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Creates the first admin account from {@code backoffice.bootstrap-admin.*}
 * when the user table is empty. Does nothing once any user exists.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final StaffUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final BackofficeProperties properties;

    public DataInitializer(StaffUserRepository userRepository,
                           PasswordEncoder passwordEncoder,
                           BackofficeProperties properties) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        if (userRepository.count() > 0) {
            return;
        }
        BackofficeProperties.BootstrapAdmin admin = properties.bootstrapAdmin();
        if (StringUtils.isAnyBlank(admin.email(), admin.password())) {
            log.warn("No users exist and backoffice.bootstrap-admin is not configured; nobody can log in");
            return;
        }
        StaffUser user = userRepository.save(StaffUser.builder()
                .email(admin.email().trim().toLowerCase(Locale.ROOT))
                .name(admin.name())
                .role(Role.ADMIN)
                .passwordHash(passwordEncoder.encode(admin.password()))
                .build());
        log.info("Created bootstrap admin {} ({})", user.getId(), user.getEmail());
    }
}
