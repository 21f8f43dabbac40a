package com.care.backoffice.service;

import com.care.backoffice.entity.Patient;
import com.care.backoffice.entity.PatientServiceUsage;
import com.care.backoffice.exception.IntegrityException;
import com.care.backoffice.repository.MedicalServiceRepository;
import com.care.backoffice.repository.PatientServiceUsageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps a patient's service-usage rows equal to a desired set of service ids
 * with the fewest inserts and deletes. Rows for ids kept in the set are not
 * touched, so their {@code usedAt} survives. Must run inside the caller's
 * transaction.
 */
@Component
public class ServiceUsageReconciler {

    private static final Logger log = LoggerFactory.getLogger(ServiceUsageReconciler.class);

    private final PatientServiceUsageRepository usageRepository;
    private final MedicalServiceRepository serviceRepository;

    public ServiceUsageReconciler(PatientServiceUsageRepository usageRepository,
                                  MedicalServiceRepository serviceRepository) {
        this.usageRepository = usageRepository;
        this.serviceRepository = serviceRepository;
    }

    /** Insert/delete plan for one patient. */
    public record UsageDiff(Set<Long> toCreate, Set<Long> toDelete) {

        public static UsageDiff between(Collection<Long> existing, Collection<Long> desired) {
            Set<Long> toCreate = new LinkedHashSet<>(desired);
            toCreate.removeAll(existing);
            Set<Long> toDelete = new LinkedHashSet<>(existing);
            toDelete.removeAll(desired);
            return new UsageDiff(toCreate, toDelete);
        }

        public boolean isEmpty() {
            return toCreate.isEmpty() && toDelete.isEmpty();
        }
    }

    /** Records usages for a freshly created patient; duplicate ids collapse to one row. */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordInitial(Patient patient, Collection<Long> serviceIds) {
        Set<Long> desired = new LinkedHashSet<>(serviceIds);
        if (desired.isEmpty()) return;
        requireExisting(desired);
        insert(patient, desired);
        log.info("Recorded {} service usage(s) for patient {}", desired.size(), patient.getId());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public UsageDiff reconcile(Patient patient, Collection<Long> serviceIds) {
        Set<Long> desired = new LinkedHashSet<>(serviceIds);
        requireExisting(desired);

        List<Long> existing = usageRepository.findServiceIdsByPatientId(patient.getId());
        UsageDiff diff = UsageDiff.between(existing, desired);
        if (diff.isEmpty()) return diff;

        if (!diff.toDelete().isEmpty()) {
            usageRepository.deleteByPatientIdAndServiceIdIn(patient.getId(), diff.toDelete());
        }
        insert(patient, diff.toCreate());
        log.info("Reconciled service usage for patient {}: +{} -{}", patient.getId(), diff.toCreate(), diff.toDelete());
        return diff;
    }

    private void insert(Patient patient, Set<Long> serviceIds) {
        if (serviceIds.isEmpty()) return;
        Instant now = Instant.now();
        List<PatientServiceUsage> rows = serviceIds.stream()
                .map(serviceId -> PatientServiceUsage.builder()
                        .patient(patient)
                        .service(serviceRepository.getReferenceById(serviceId))
                        .usedAt(now)
                        .build())
                .toList();
        usageRepository.saveAll(rows);
        usageRepository.flush();
    }

    private void requireExisting(Set<Long> serviceIds) {
        if (serviceIds.isEmpty()) return;
        long found = serviceRepository.countByIdIn(serviceIds);
        if (found != serviceIds.size()) {
            throw new IntegrityException("serviceIds", "One or more services do not exist.");
        }
    }
}
