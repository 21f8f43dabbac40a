package com.care.backoffice.service;

import com.care.backoffice.dto.PatientAccountRequest;
import com.care.backoffice.dto.PatientAccountView;
import com.care.backoffice.entity.Patient;
import com.care.backoffice.entity.PatientAccount;
import com.care.backoffice.exception.IntegrityException;
import com.care.backoffice.repository.PatientAccountRepository;
import com.care.backoffice.repository.PatientRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/** Portal logins created by staff for existing patients. */
@Service
@RequiredArgsConstructor
public class PatientAccountService {

    private static final Logger log = LoggerFactory.getLogger(PatientAccountService.class);

    private final PatientAccountRepository accountRepository;
    private final PatientRepository patientRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional(readOnly = true)
    public Optional<PatientAccountView> findByEmail(String email) {
        return accountRepository.findByEmail(email.trim().toLowerCase(Locale.ROOT)).map(PatientAccountView::from);
    }

    @Transactional
    public PatientAccountView create(PatientAccountRequest request) {
        Patient patient = patientRepository.findById(request.getPatientId())
                .orElseThrow(() -> new IntegrityException("patientId", "Patient does not exist."));
        PatientAccount account = PatientAccount.builder()
                .patient(patient)
                .email(request.getEmail().trim().toLowerCase(Locale.ROOT))
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .build();
        account = accountRepository.saveAndFlush(account);
        log.info("Created portal account {} for patient {}", account.getId(), patient.getId());
        return PatientAccountView.from(account);
    }
}
