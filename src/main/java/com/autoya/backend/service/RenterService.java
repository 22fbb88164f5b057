package com.autoya.backend.service;

import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import com.autoya.backend.domain.Renter;
import com.autoya.backend.repository.RenterRepository;
import com.autoya.backend.repository.UnitOfWork;
import com.autoya.backend.result.PersistenceFailures;
import com.autoya.backend.result.ServiceError;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.util.MetricsHelper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service for managing vehicle renters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RenterService {

    static final String ENTITY = "Arrendatario";
    private static final String METRIC_ENTITY = "renter";

    private final RenterRepository renterRepository;
    private final UnitOfWork unitOfWork;
    private final MetricsHelper metricsHelper;

    @Transactional(readOnly = true)
    public List<Renter> list() {
        log.debug("Listing renters");
        return renterRepository.findAll();
    }

    @Transactional(readOnly = true)
    public ServiceResult<Renter> findById(Long renterId) {
        log.debug("Getting renter: id={}", renterId);
        return renterRepository.findById(renterId)
                .map(ServiceResult::success)
                .orElseGet(() -> ServiceResult.failure(ServiceError.notFound(ENTITY, renterId)));
    }

    public ServiceResult<Renter> save(Renter renter) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "save", () -> {
            log.info("Creating renter: email={}", renter.getEmail());
            try {
                Renter saved = unitOfWork.complete(() -> renterRepository.save(renter));
                log.info("Renter created: id={}", saved.getId());
                return ServiceResult.success(saved);
            } catch (DataAccessException | TransactionException e) {
                log.warn("Saving renter failed: {}", e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("saving", ENTITY, e));
            }
        });
    }

    /**
     * Replaces every field of an existing renter with the incoming values.
     *
     * @param renterId the renter ID
     * @param renter incoming values
     * @return the updated renter, or NOT_FOUND with nothing written
     */
    public ServiceResult<Renter> update(Long renterId, Renter renter) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "update", () -> {
            log.info("Updating renter: id={}", renterId);
            try {
                return unitOfWork.complete(() -> {
                    Optional<Renter> found = renterRepository.findById(renterId);
                    if (found.isEmpty()) {
                        return ServiceResult.<Renter>failure(ServiceError.notFound(ENTITY, renterId));
                    }
                    Renter existing = found.get();
                    existing.setFirstName(renter.getFirstName());
                    existing.setLastName(renter.getLastName());
                    existing.setEmail(renter.getEmail());
                    existing.setPhone(renter.getPhone());
                    return ServiceResult.success(renterRepository.save(existing));
                });
            } catch (DataAccessException | TransactionException e) {
                log.warn("Updating renter failed: id={}, error={}", renterId, e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("updating", ENTITY, e));
            }
        });
    }

    /**
     * Deletes a renter. Vehicles assigned to it are released by the database;
     * agreements still referencing it make the delete fail with CONFLICT.
     *
     * @param renterId the renter ID
     * @return snapshot of the removed renter
     */
    public ServiceResult<Renter> delete(Long renterId) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "delete", () -> {
            log.info("Deleting renter: id={}", renterId);
            try {
                return unitOfWork.complete(() -> {
                    Optional<Renter> found = renterRepository.findById(renterId);
                    if (found.isEmpty()) {
                        return ServiceResult.<Renter>failure(ServiceError.notFound(ENTITY, renterId));
                    }
                    renterRepository.delete(found.get());
                    return ServiceResult.success(found.get());
                });
            } catch (DataAccessException | TransactionException e) {
                log.warn("Deleting renter failed: id={}, error={}", renterId, e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("deleting", ENTITY, e));
            }
        });
    }
}
