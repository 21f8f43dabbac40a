package com.care.backoffice.controller;

import com.care.backoffice.dto.PatientAccountRequest;
import com.care.backoffice.dto.PatientAccountView;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.service.PatientAccountService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/patient-accounts")
public class PatientAccountController {

    private final PatientAccountService accountService;

    public PatientAccountController(PatientAccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    public PatientAccountView findByEmail(@RequestParam String email) {
        return accountService.findByEmail(email)
                .orElseThrow(() -> new NotFoundException("patientAccount", email));
    }

    @PostMapping
    public ResponseEntity<PatientAccountView> create(@Valid @RequestBody PatientAccountRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.create(body));
    }
}
