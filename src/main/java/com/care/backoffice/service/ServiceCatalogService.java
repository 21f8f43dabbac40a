package com.care.backoffice.service;

import com.care.backoffice.dto.ServiceCreateRequest;
import com.care.backoffice.dto.ServiceUpdateRequest;
import com.care.backoffice.dto.ServiceView;
import com.care.backoffice.entity.MedicalService;
import com.care.backoffice.exception.IntegrityException;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.repository.AppointmentRepository;
import com.care.backoffice.repository.MedicalServiceRepository;
import com.care.backoffice.repository.PatientServiceUsageRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The clinic's service catalog. Services form at most two levels: a top-level
 * service and its sub-services.
 */
@Service
@RequiredArgsConstructor
public class ServiceCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ServiceCatalogService.class);

    static final String OWN_PARENT_MSG = "A service cannot be its own parent";

    private final MedicalServiceRepository serviceRepository;
    private final PatientServiceUsageRepository usageRepository;
    private final AppointmentRepository appointmentRepository;

    @Transactional(readOnly = true)
    public List<ServiceView> list(String query) {
        String q = StringUtils.trimToNull(query);
        List<MedicalService> services = q == null ? serviceRepository.findAllOrdered() : serviceRepository.search(q);
        return services.stream().map(this::view).toList();
    }

    @Transactional(readOnly = true)
    public ServiceView get(Long id) {
        return view(load(id));
    }

    @Transactional
    public ServiceView create(ServiceCreateRequest request) {
        MedicalService service = MedicalService.builder()
                .name(request.getName().trim())
                .description(request.getDescription().trim())
                .shortDescription(StringUtils.trimToNull(request.getShortDescription()))
                .priority(request.getPriority())
                .durationMinutes(request.getDurationMinutes())
                .priceCents(request.getPriceCents())
                .active(request.getActive() == null || request.getActive())
                .images(normalizeImages(request.getImages()))
                .build();
        if (request.getParentId() != null) {
            service.setParent(requireParent(null, request.getParentId()));
        }
        service = serviceRepository.save(service);
        log.info("Created service {} ({})", service.getId(), service.getName());
        return view(service);
    }

    @Transactional
    public ServiceView update(Long id, ServiceUpdateRequest request) {
        MedicalService service = load(id);
        if (request.getParentId() != null && request.getParentId().isPresent()
                && id.equals(request.getParentId().get())) {
            throw ValidationException.of("parentId", OWN_PARENT_MSG);
        }

        if (request.getName() != null) service.setName(request.getName().trim());
        if (request.getDescription() != null) service.setDescription(request.getDescription().trim());
        if (request.getShortDescription() != null) {
            service.setShortDescription(StringUtils.trimToNull(request.getShortDescription().orElse(null)));
        }
        if (request.getPriority() != null) service.setPriority(request.getPriority().orElse(null));
        if (request.getDurationMinutes() != null) service.setDurationMinutes(request.getDurationMinutes().orElse(null));
        if (request.getPriceCents() != null) service.setPriceCents(request.getPriceCents().orElse(null));
        if (request.getActive() != null) service.setActive(request.getActive());
        if (request.getImages() != null) {
            service.getImages().clear();
            service.getImages().addAll(normalizeImages(request.getImages()));
        }
        if (request.getParentId() != null) {
            Long parentId = request.getParentId().orElse(null);
            service.setParent(parentId != null ? requireParent(service, parentId) : null);
        }

        service = serviceRepository.saveAndFlush(service);
        log.info("Updated service {}", id);
        return view(service);
    }

    /**
     * Deletes a service. Its sub-services become top-level and its usage rows go
     * with it; a service still booked in appointments cannot be deleted.
     */
    @Transactional
    public void delete(Long id) {
        MedicalService service = load(id);
        if (appointmentRepository.countByServiceId(id) > 0) {
            throw new IntegrityException("id", "Service is used by appointments and cannot be deleted.");
        }
        int detached = serviceRepository.detachChildren(id);
        usageRepository.deleteByServiceId(id);
        serviceRepository.delete(service);
        log.info("Deleted service {} (detached {} sub-services)", id, detached);
    }

    private MedicalService requireParent(MedicalService child, Long parentId) {
        MedicalService parent = serviceRepository.findById(parentId)
                .orElseThrow(() -> new IntegrityException("parentId", "Parent service does not exist."));
        if (parent.getParent() != null) {
            throw ValidationException.of("parentId", "A sub-service cannot have sub-services");
        }
        if (child != null && child.getId() != null
                && !serviceRepository.findByParentIdOrderByNameAsc(child.getId()).isEmpty()) {
            throw ValidationException.of("parentId", "A service with sub-services cannot be nested");
        }
        return parent;
    }

    private static List<String> normalizeImages(List<String> images) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String image : images) {
            String trimmed = StringUtils.trimToNull(image);
            if (trimmed != null) unique.add(trimmed);
        }
        if (unique.isEmpty()) {
            throw ValidationException.of("images", "At least one image is required");
        }
        return new ArrayList<>(unique);
    }

    private MedicalService load(Long id) {
        return serviceRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("service", id));
    }

    private ServiceView view(MedicalService service) {
        return ServiceView.from(service, serviceRepository.findByParentIdOrderByNameAsc(service.getId()));
    }
}
