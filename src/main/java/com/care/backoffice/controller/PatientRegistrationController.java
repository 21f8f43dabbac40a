package com.care.backoffice.controller;

import com.care.backoffice.dto.RegisterRequest;
import com.care.backoffice.dto.RegistrationResult;
import com.care.backoffice.service.RegistrationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PatientRegistrationController {

    private final RegistrationService registrationService;

    public PatientRegistrationController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @PostMapping("/api/patient-auth/register")
    public ResponseEntity<RegistrationResult> register(@Valid @RequestBody RegisterRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.register(body));
    }
}
