package com.care.backoffice.storage;

import com.care.backoffice.config.BackofficeProperties;
import com.care.backoffice.exception.UpstreamStorageException;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP object store: {@code PUT {base}/{filename}} with a bearer token. The store
 * answers with JSON carrying the public {@code url}; when it does not, the
 * object URL itself is used.
 */
@Component
@ConditionalOnProperty(prefix = "backoffice.storage", name = "backend", havingValue = "blob")
public class BlobHttpStorage implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(BlobHttpStorage.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String token;

    public BlobHttpStorage(RestTemplateBuilder builder, BackofficeProperties properties) {
        BackofficeProperties.Storage storage = properties.storage();
        if (StringUtils.isBlank(storage.blobBaseUrl())) {
            throw new IllegalStateException("backoffice.storage.blob-base-url must be set for the blob backend");
        }
        this.baseUrl = StringUtils.removeEnd(storage.blobBaseUrl().trim(), "/");
        this.token = StringUtils.trimToEmpty(storage.blobToken());
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(60))
                .build();
    }

    @Override
    public String store(byte[] content, String filename, String contentType) {
        String objectUrl = baseUrl + "/" + filename;
        HttpHeaders headers = headers();
        headers.setContentType(MediaType.parseMediaType(contentType));
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    objectUrl, HttpMethod.PUT, new HttpEntity<>(content, headers), JsonNode.class);
            JsonNode body = response.getBody();
            String url = body != null ? body.path("url").asText("") : "";
            log.info("Uploaded {} ({} bytes) to blob store", filename, content.length);
            return url.isEmpty() ? objectUrl : url;
        } catch (HttpStatusCodeException e) {
            log.error("Blob store rejected upload of {}: {} {}", filename, e.getStatusCode(), e.getResponseBodyAsString());
            throw new UpstreamStorageException("File storage is unavailable.", e);
        } catch (ResourceAccessException e) {
            log.error("Blob store unreachable while uploading {}", filename, e);
            throw new UpstreamStorageException("File storage is unavailable.", e);
        }
    }

    @Override
    public boolean delete(String url) {
        if (url == null || !url.startsWith(baseUrl + "/")) {
            return false;
        }
        try {
            restTemplate.exchange(url, HttpMethod.DELETE, new HttpEntity<>(headers()), Void.class);
            log.info("Deleted blob {}", url);
            return true;
        } catch (HttpStatusCodeException | ResourceAccessException e) {
            throw new UpstreamStorageException("File storage is unavailable.", e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        if (!token.isEmpty()) {
            headers.setBearerAuth(token);
        }
        return headers;
    }
}
