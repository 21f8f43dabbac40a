package com.care.backoffice.controller;

import com.care.backoffice.dto.PatientCreateRequest;
import com.care.backoffice.dto.PatientUpdateRequest;
import com.care.backoffice.dto.PatientView;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.service.PatientService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/patients")
public class PatientController {

    private final PatientService patientService;

    public PatientController(PatientService patientService) {
        this.patientService = patientService;
    }

    /** Full list, or the single patient with {@code email} when given. */
    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String email) {
        if (StringUtils.hasText(email)) {
            PatientView patient = patientService.findByEmail(email)
                    .orElseThrow(() -> new NotFoundException("patient", email));
            return ResponseEntity.ok(patient);
        }
        List<PatientView> patients = patientService.list();
        return ResponseEntity.ok(patients);
    }

    @PostMapping
    public ResponseEntity<PatientView> create(@Valid @RequestBody PatientCreateRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(patientService.create(body));
    }

    @GetMapping("/{id}")
    public PatientView get(@PathVariable Long id) {
        return patientService.get(id);
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public PatientView update(@PathVariable Long id, @Valid @RequestBody PatientUpdateRequest body) {
        return patientService.update(id, body);
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable Long id) {
        patientService.delete(id);
        return Map.of("ok", true);
    }
}
