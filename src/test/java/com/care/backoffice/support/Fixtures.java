package com.care.backoffice.support;

import com.care.backoffice.entity.MedicalService;
import com.care.backoffice.entity.Patient;
import com.care.backoffice.entity.Role;
import com.care.backoffice.entity.StaffUser;
import com.care.backoffice.repository.MedicalServiceRepository;
import com.care.backoffice.repository.PatientRepository;
import com.care.backoffice.repository.StaffUserRepository;

import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    private Fixtures() {
    }

    public static MedicalService service(MedicalServiceRepository repo, String name) {
        return repo.save(MedicalService.builder()
                .name(name)
                .description(name + " description")
                .durationMinutes(30)
                .priceCents(5000)
                .images(new ArrayList<>(List.of("/uploads/" + name.toLowerCase().replace(' ', '-') + ".jpg")))
                .build());
    }

    public static Patient patient(PatientRepository repo, String firstName, String lastName) {
        return repo.save(Patient.builder()
                .firstName(firstName)
                .lastName(lastName)
                .build());
    }

    public static StaffUser user(StaffUserRepository repo, String email, Role role, String passwordHash) {
        return repo.save(StaffUser.builder()
                .email(email)
                .name(email.substring(0, email.indexOf('@')))
                .role(role)
                .passwordHash(passwordHash)
                .build());
    }
}
