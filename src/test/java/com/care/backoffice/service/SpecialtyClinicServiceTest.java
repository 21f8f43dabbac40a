package com.care.backoffice.service;

import com.care.backoffice.dto.SpecialtyClinicRequest;
import com.care.backoffice.entity.SpecialtyClinic;
import com.care.backoffice.exception.FieldError;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.support.DatabaseCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SpecialtyClinicServiceTest {

    @Autowired
    private SpecialtyClinicService clinicService;
    @Autowired
    private JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.clean(jdbc);
    }

    @Test
    void everyFieldIsRequiredOnCreate() {
        ValidationException ex = assertThrows(ValidationException.class, () ->
                clinicService.create(SpecialtyClinicRequest.builder().title(" ").build()));

        assertEquals(List.of("title", "name", "description", "image"),
                ex.getDetails().stream().map(FieldError::field).toList());
        assertTrue(clinicService.list().isEmpty());
    }

    @Test
    void oneMissingFieldIsReportedAlone() {
        ValidationException ex = assertThrows(ValidationException.class, () ->
                clinicService.create(SpecialtyClinicRequest.builder()
                        .title("Smile Studio")
                        .name("Cosmetic dentistry")
                        .description("Veneers and whitening.")
                        .build()));

        assertEquals(1, ex.getDetails().size());
        assertEquals("image", ex.getDetails().get(0).field());
    }

    @Test
    void partialUpdateKeepsOtherFields() {
        SpecialtyClinic clinic = clinicService.create(SpecialtyClinicRequest.builder()
                .title(" Smile Studio ")
                .name("Cosmetic dentistry")
                .description("Veneers and whitening.")
                .image("/uploads/smile.jpg")
                .build());
        assertEquals("Smile Studio", clinic.getTitle());

        SpecialtyClinic updated = clinicService.update(clinic.getId(),
                SpecialtyClinicRequest.builder().name("Aesthetic dentistry").build());

        assertEquals("Aesthetic dentistry", updated.getName());
        assertEquals("Smile Studio", updated.getTitle());
        assertEquals("/uploads/smile.jpg", updated.getImage());
    }
}
