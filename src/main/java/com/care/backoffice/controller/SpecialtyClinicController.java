package com.care.backoffice.controller;

import com.care.backoffice.dto.SpecialtyClinicRequest;
import com.care.backoffice.entity.SpecialtyClinic;
import com.care.backoffice.service.SpecialtyClinicService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/specialty-clinics")
public class SpecialtyClinicController {

    private final SpecialtyClinicService clinicService;

    public SpecialtyClinicController(SpecialtyClinicService clinicService) {
        this.clinicService = clinicService;
    }

    @GetMapping
    public List<SpecialtyClinic> list() {
        return clinicService.list();
    }

    @PostMapping
    public ResponseEntity<SpecialtyClinic> create(@Valid @RequestBody SpecialtyClinicRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(clinicService.create(body));
    }

    @GetMapping("/{id}")
    public SpecialtyClinic get(@PathVariable Long id) {
        return clinicService.get(id);
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public SpecialtyClinic update(@PathVariable Long id, @Valid @RequestBody SpecialtyClinicRequest body) {
        return clinicService.update(id, body);
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable Long id) {
        clinicService.delete(id);
        return Map.of("ok", true);
    }
}
