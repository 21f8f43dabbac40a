package com.care.backoffice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.util.Set;

/**
 * Settings under the {@code backoffice} prefix. Read once at startup.
 */
@ConfigurationProperties(prefix = "backoffice")
public record BackofficeProperties(
        @DefaultValue Cors cors,
        @DefaultValue Upload upload,
        @DefaultValue Storage storage,
        @DefaultValue BootstrapAdmin bootstrapAdmin
) {

    /**
     * Allowed origins for the endpoints called from the public site.
     * The patient portal falls back to the booking origin when unset.
     */
    public record Cors(
            @DefaultValue("*") String publicBookingOrigin,
            String patientPortalOrigin
    ) {
        public String portalOrigin() {
            return patientPortalOrigin == null || patientPortalOrigin.isBlank() ? publicBookingOrigin : patientPortalOrigin;
        }
    }

    public record Upload(
            @DefaultValue("4MB") DataSize maxFileSize,
            @DefaultValue({"image/jpeg", "image/png", "image/webp", "image/gif", "image/svg+xml"}) Set<String> allowedTypes
    ) {
    }

    /** {@code backend} is {@code local} or {@code blob}. */
    public record Storage(
            @DefaultValue("local") String backend,
            @DefaultValue("uploads") String localDirectory,
            @DefaultValue("/uploads") String publicPath,
            String blobBaseUrl,
            String blobToken
    ) {
    }

    public record BootstrapAdmin(
            String email,
            String password,
            @DefaultValue("Administrator") String name
    ) {
    }
}
