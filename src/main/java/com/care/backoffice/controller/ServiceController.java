package com.care.backoffice.controller;

import com.care.backoffice.dto.ServiceCreateRequest;
import com.care.backoffice.dto.ServiceUpdateRequest;
import com.care.backoffice.dto.ServiceView;
import com.care.backoffice.service.ServiceCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/services")
public class ServiceController {

    private final ServiceCatalogService catalogService;

    public ServiceController(ServiceCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public List<ServiceView> list(@RequestParam(required = false) String q) {
        return catalogService.list(q);
    }

    @PostMapping
    public ResponseEntity<ServiceView> create(@Valid @RequestBody ServiceCreateRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.create(body));
    }

    @GetMapping("/{id}")
    public ServiceView get(@PathVariable Long id) {
        return catalogService.get(id);
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public ServiceView update(@PathVariable Long id, @Valid @RequestBody ServiceUpdateRequest body) {
        return catalogService.update(id, body);
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable Long id) {
        catalogService.delete(id);
        return Map.of("ok", true);
    }
}
