package com.care.backoffice.controller;

import com.care.backoffice.dto.DoctorRequest;
import com.care.backoffice.entity.Doctor;
import com.care.backoffice.service.DoctorService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/doctors")
public class DoctorController {

    private final DoctorService doctorService;

    public DoctorController(DoctorService doctorService) {
        this.doctorService = doctorService;
    }

    @GetMapping
    public List<Doctor> list(@RequestParam(required = false) String q,
                             @RequestParam(required = false) Boolean featured,
                             @RequestParam(required = false) Boolean active) {
        return doctorService.list(q, featured, active);
    }

    @PostMapping
    public ResponseEntity<Doctor> create(@Valid @RequestBody DoctorRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(doctorService.create(body));
    }

    @GetMapping("/{id}")
    public Doctor get(@PathVariable Long id) {
        return doctorService.get(id);
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public Doctor update(@PathVariable Long id, @Valid @RequestBody DoctorRequest body) {
        return doctorService.update(id, body);
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable Long id) {
        doctorService.delete(id);
        return Map.of("ok", true);
    }
}
