package com.care.backoffice.controller;

import com.care.backoffice.dto.AppointmentCreateRequest;
import com.care.backoffice.dto.AppointmentUpdateRequest;
import com.care.backoffice.dto.AppointmentView;
import com.care.backoffice.entity.AppointmentStatus;
import com.care.backoffice.service.AppointmentService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final AppointmentService appointmentService;

    public AppointmentController(AppointmentService appointmentService) {
        this.appointmentService = appointmentService;
    }

    @GetMapping
    public List<AppointmentView> list(
            @RequestParam(required = false) AppointmentStatus status,
            @RequestParam(required = false) Long patientId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return appointmentService.list(status, patientId, from, to);
    }

    @PostMapping
    public ResponseEntity<AppointmentView> create(@Valid @RequestBody AppointmentCreateRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(appointmentService.create(body));
    }

    @GetMapping("/{id}")
    public AppointmentView get(@PathVariable Long id) {
        return appointmentService.get(id);
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public AppointmentView update(@PathVariable Long id, @Valid @RequestBody AppointmentUpdateRequest body) {
        return appointmentService.update(id, body);
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable Long id) {
        appointmentService.delete(id);
        return Map.of("ok", true);
    }
}
