package com.care.backoffice.controller;

import com.care.backoffice.dto.AppointmentView;
import com.care.backoffice.dto.PublicBookingRequest;
import com.care.backoffice.service.AppointmentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Booking endpoint for the public website. No session required; CORS headers
 * come from {@link com.care.backoffice.config.PublicCorsFilter}.
 */
@RestController
public class PublicAppointmentController {

    private final AppointmentService appointmentService;

    public PublicAppointmentController(AppointmentService appointmentService) {
        this.appointmentService = appointmentService;
    }

    @PostMapping("/api/public/appointments")
    public ResponseEntity<AppointmentView> book(@Valid @RequestBody PublicBookingRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(appointmentService.createPublic(body));
    }
}
