package com.care.backoffice.controller;

import com.care.backoffice.entity.MedicalService;
import com.care.backoffice.repository.MedicalServiceRepository;
import com.care.backoffice.support.DatabaseCleaner;
import com.care.backoffice.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class PublicAppointmentControllerTest {

    private static final String ORIGIN = "https://clinic.example";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private MedicalServiceRepository serviceRepository;
    @Autowired
    private JdbcTemplate jdbc;

    private MedicalService checkup;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.clean(jdbc);
        checkup = Fixtures.service(serviceRepository, "Checkup");
    }

    @Test
    void preflightIsAnsweredWithCorsHeaders() throws Exception {
        mockMvc.perform(options("/api/public/appointments")
                        .header("Origin", ORIGIN)
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isNoContent())
                .andExpect(header().string("Access-Control-Allow-Origin", ORIGIN))
                .andExpect(header().string("Access-Control-Allow-Methods", "POST,OPTIONS"));
    }

    @Test
    void guestCanBookWithoutSession() throws Exception {
        mockMvc.perform(post("/api/public/appointments")
                        .header("Origin", ORIGIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientName\":\"Web Visitor\",\"serviceId\":" + checkup.getId()
                                + ",\"date\":\"2030-05-01T14:30:00Z\",\"status\":\"COMPLETED\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Access-Control-Allow-Origin", ORIGIN))
                .andExpect(jsonPath("$.status").value("BOOKED"))
                .andExpect(jsonPath("$.customPatientName").value("Web Visitor"));
    }

    @Test
    void validationErrorsCarryCorsHeaders() throws Exception {
        mockMvc.perform(post("/api/public/appointments")
                        .header("Origin", ORIGIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientName\":\"Web Visitor\",\"date\":\"2030-05-01T14:30:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("Access-Control-Allow-Origin", ORIGIN))
                .andExpect(jsonPath("$.details[0].field").value("serviceId"));
    }

    @Test
    void malformedDateNamesTheField() throws Exception {
        mockMvc.perform(post("/api/public/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientName\":\"Web Visitor\",\"serviceId\":" + checkup.getId()
                                + ",\"date\":\"next tuesday\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("date"));
    }
}
