package com.care.backoffice.repository;

import com.care.backoffice.entity.Doctor;
import org.springframework.data.jpa.domain.Specification;

public final class DoctorSpecifications {

    private DoctorSpecifications() {
    }

    public static Specification<Doctor> matches(String q) {
        return (root, query, cb) -> {
            if (q == null) return null;
            String pattern = "%" + q.toLowerCase() + "%";
            return cb.or(
                    cb.like(cb.lower(root.get("fullName")), pattern),
                    cb.like(cb.lower(root.get("specialty")), pattern),
                    cb.like(cb.lower(root.get("title")), pattern));
        };
    }

    public static Specification<Doctor> featured(Boolean featured) {
        return (root, query, cb) -> featured == null ? null : cb.equal(root.get("featured"), featured);
    }

    public static Specification<Doctor> active(Boolean active) {
        return (root, query, cb) -> active == null ? null : cb.equal(root.get("active"), active);
    }
}
