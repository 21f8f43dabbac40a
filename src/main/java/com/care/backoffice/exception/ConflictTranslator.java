package com.care.backoffice.exception;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a storage-level constraint violation to the error the client sees.
 * Unique violations on a known constraint become a field-specific 409,
 * other unique violations a generic 409, anything else (foreign keys) a 400.
 */
@Component
public class ConflictTranslator {

    static final String DUPLICATE_MESSAGE = "Duplicate value detected.";

    private static final String UNIQUE_VIOLATION = "23505";

    private static final Map<String, FieldError> UNIQUE_FIELDS = new LinkedHashMap<>();

    static {
        UNIQUE_FIELDS.put("uk_patient_email", new FieldError("email", "Email already in use."));
        UNIQUE_FIELDS.put("uk_patient_phone", new FieldError("phone", "Phone number already in use."));
        UNIQUE_FIELDS.put("uk_doctor_email", new FieldError("email", "Email already in use."));
        UNIQUE_FIELDS.put("uk_doctor_phone", new FieldError("phone", "Phone number already in use."));
        UNIQUE_FIELDS.put("uk_app_user_email", new FieldError("email", "Email already in use."));
        UNIQUE_FIELDS.put("uk_patient_account_email", new FieldError("email", "Email already in use."));
        UNIQUE_FIELDS.put("uk_patient_account_patient", new FieldError("patientId", "Account already exists for this patient."));
        UNIQUE_FIELDS.put("uk_blog_slug", new FieldError("slug", "Slug already in use."));
        UNIQUE_FIELDS.put("uk_patient_service_usage", new FieldError("serviceIds", "Service already recorded for this patient."));
    }

    public BackofficeException translate(DataIntegrityViolationException ex) {
        String haystack = describe(ex);
        for (Map.Entry<String, FieldError> entry : UNIQUE_FIELDS.entrySet()) {
            if (haystack.contains(entry.getKey())) {
                FieldError field = entry.getValue();
                return new ConflictException(field.field(), field.message());
            }
        }
        if (isUniqueViolation(ex)) {
            return new ConflictException(null, DUPLICATE_MESSAGE);
        }
        return new IntegrityException("The record is referenced by, or refers to, a record that does not exist or is still in use.", ex);
    }

    private static String describe(Throwable ex) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException cve && cve.getConstraintName() != null) {
                sb.append(cve.getConstraintName()).append(' ');
            }
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append(' ');
            }
            if (t.getCause() == t) break;
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean isUniqueViolation(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }
}
