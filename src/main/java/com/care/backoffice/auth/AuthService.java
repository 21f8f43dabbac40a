package com.care.backoffice.auth;

import com.care.backoffice.dto.UserView;
import com.care.backoffice.entity.StaffUser;
import com.care.backoffice.repository.StaffUserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final StaffUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    /**
     * Checks credentials. Unknown email and wrong password are indistinguishable
     * to the caller.
     */
    @Transactional(readOnly = true)
    public Optional<UserView> authenticate(String email, String password) {
        Optional<StaffUser> user = userRepository.findByEmailIgnoreCase(email.trim());
        if (user.isEmpty() || !passwordEncoder.matches(password, user.get().getPasswordHash())) {
            log.warn("Failed login for {}", email);
            return Optional.empty();
        }
        log.info("User {} logged in", user.get().getId());
        return user.map(UserView::from);
    }

    @Transactional(readOnly = true)
    public Optional<UserView> findUser(Long id) {
        return userRepository.findById(id).map(UserView::from);
    }
}
