package com.care.backoffice.service;

import com.care.backoffice.dto.RegisterRequest;
import com.care.backoffice.dto.RegistrationResult;
import com.care.backoffice.entity.Patient;
import com.care.backoffice.entity.PatientAccount;
import com.care.backoffice.exception.ConflictException;
import com.care.backoffice.exception.FieldError;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.repository.PatientAccountRepository;
import com.care.backoffice.repository.PatientRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Patient portal self-registration. A registrant whose email or phone matches
 * an existing patient is attached to that record (which takes the submitted
 * details); otherwise a new patient is created. The patient and its account are
 * written in one transaction.
 */
@Service
@RequiredArgsConstructor
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    static final String EMAIL_IN_USE_MSG = "Email already in use.";

    private final PatientRepository patientRepository;
    private final PatientAccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional
    public RegistrationResult register(RegisterRequest request) {
        String firstName = collapse(request.getFirstName());
        String lastName = collapse(request.getLastName());
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);
        String phone = StringUtils.trimToNull(request.getPhone());
        validate(firstName, lastName, phone, request);

        if (accountRepository.existsByEmail(email)) {
            throw new ConflictException("email", EMAIL_IN_USE_MSG);
        }

        Optional<Patient> match = patientRepository.findByEmail(email);
        if (match.isEmpty() && phone != null) {
            match = patientRepository.findByPhone(phone);
        }

        Patient patient;
        if (match.isPresent()) {
            patient = match.get();
            if (accountRepository.existsByPatientId(patient.getId())) {
                throw new ConflictException("email", EMAIL_IN_USE_MSG);
            }
            patient.setFirstName(firstName);
            patient.setLastName(lastName);
            patient.setEmail(email);
            patient.setPhone(phone);
            log.info("Registration matched existing patient {}", patient.getId());
        } else {
            patient = Patient.builder()
                    .firstName(firstName)
                    .lastName(lastName)
                    .email(email)
                    .phone(phone)
                    .build();
        }
        patient = patientRepository.saveAndFlush(patient);

        PatientAccount account = accountRepository.saveAndFlush(PatientAccount.builder()
                .patient(patient)
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .build());
        log.info("Registered portal account {} for patient {}", account.getId(), patient.getId());

        return new RegistrationResult(
                new RegistrationResult.PatientSummary(patient.getId(), patient.getFirstName(),
                        patient.getLastName(), patient.getEmail(), patient.getPhone()),
                new RegistrationResult.AccountSummary(account.getId(), account.getCreatedAt()));
    }

    private static void validate(String firstName, String lastName, String phone, RegisterRequest request) {
        List<FieldError> errors = new ArrayList<>();
        if (firstName.isEmpty()) errors.add(new FieldError("firstName", "First name is required"));
        if (lastName.isEmpty()) errors.add(new FieldError("lastName", "Last name is required"));
        if (phone != null && phone.length() < 5) errors.add(new FieldError("phone", "Phone number is too short"));
        if (!request.getPassword().equals(request.getConfirmPassword())) {
            errors.add(new FieldError("confirmPassword", "Passwords do not match"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    static String collapse(String name) {
        return StringUtils.normalizeSpace(StringUtils.defaultString(name));
    }
}
