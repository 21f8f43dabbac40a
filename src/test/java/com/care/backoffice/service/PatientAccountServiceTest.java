package com.care.backoffice.service;

import com.care.backoffice.dto.PatientAccountRequest;
import com.care.backoffice.dto.PatientAccountView;
import com.care.backoffice.entity.Patient;
import com.care.backoffice.entity.PatientAccount;
import com.care.backoffice.entity.Role;
import com.care.backoffice.exception.ConflictException;
import com.care.backoffice.exception.ConflictTranslator;
import com.care.backoffice.exception.IntegrityException;
import com.care.backoffice.repository.PatientAccountRepository;
import com.care.backoffice.repository.PatientRepository;
import com.care.backoffice.repository.StaffUserRepository;
import com.care.backoffice.support.AdminSessions;
import com.care.backoffice.support.DatabaseCleaner;
import com.care.backoffice.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class PatientAccountServiceTest {

    @Autowired
    private PatientAccountService accountService;
    @Autowired
    private PatientAccountRepository accountRepository;
    @Autowired
    private PatientRepository patientRepository;
    @Autowired
    private StaffUserRepository userRepository;
    @Autowired
    private ConflictTranslator conflictTranslator;
    @Autowired
    private PasswordEncoder passwordEncoder;
    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private JdbcTemplate jdbc;

    private Patient jane;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.clean(jdbc);
        jane = Fixtures.patient(patientRepository, "Jane", "Doe");
    }

    @Test
    void emailIsLowercasedAndPasswordHashed() {
        PatientAccountView created = accountService.create(request(jane.getId(), " Jane@Example.COM "));

        assertEquals("jane@example.com", created.email());
        assertEquals(jane.getId(), created.patientId());
        PatientAccount stored = accountRepository.findById(created.id()).orElseThrow();
        assertNotEquals("portal-pass", stored.getPasswordHash());
        assertTrue(passwordEncoder.matches("portal-pass", stored.getPasswordHash()));
    }

    @Test
    void secondAccountForSamePatientIsAConflict() {
        accountService.create(request(jane.getId(), "jane@example.com"));

        DataIntegrityViolationException ex = assertThrows(DataIntegrityViolationException.class, () ->
                accountService.create(request(jane.getId(), "jane.doe@example.com")));

        ConflictException conflict = assertInstanceOf(ConflictException.class, conflictTranslator.translate(ex));
        assertEquals("patientId", conflict.getField());
        assertEquals("Account already exists for this patient.", conflict.getMessage());
    }

    @Test
    void unknownPatientIsAnIntegrityError() {
        assertThrows(IntegrityException.class, () -> accountService.create(request(4040L, "ghost@example.com")));
    }

    @Test
    void lookupByEmailIgnoresCase() {
        accountService.create(request(jane.getId(), "jane@example.com"));

        assertTrue(accountService.findByEmail("  JANE@example.com").isPresent());
        assertTrue(accountService.findByEmail("john@example.com").isEmpty());
    }

    @Test
    void emailQueryReturnsAccountOrNotFound() throws Exception {
        accountService.create(request(jane.getId(), "jane@example.com"));
        MockHttpSession session = AdminSessions.loggedIn(
                Fixtures.user(userRepository, "admin@clinic.example", Role.ADMIN, "x"));

        mockMvc.perform(get("/api/patient-accounts").param("email", "Jane@Example.com").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("jane@example.com"))
                .andExpect(jsonPath("$.patientId").value(jane.getId()))
                .andExpect(jsonPath("$.passwordHash").doesNotExist());

        mockMvc.perform(get("/api/patient-accounts").param("email", "nobody@example.com").session(session))
                .andExpect(status().isNotFound());
    }

    private static PatientAccountRequest request(Long patientId, String email) {
        return PatientAccountRequest.builder()
                .patientId(patientId)
                .email(email)
                .password("portal-pass")
                .build();
    }
}
