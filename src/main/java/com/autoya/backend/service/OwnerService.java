package com.autoya.backend.service;

import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import com.autoya.backend.domain.Owner;
import com.autoya.backend.repository.OwnerRepository;
import com.autoya.backend.repository.UnitOfWork;
import com.autoya.backend.result.PersistenceFailures;
import com.autoya.backend.result.ServiceError;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.util.MetricsHelper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service for managing vehicle owners.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OwnerService {

    static final String ENTITY = "Propietario";
    private static final String METRIC_ENTITY = "owner";

    private final OwnerRepository ownerRepository;
    private final UnitOfWork unitOfWork;
    private final MetricsHelper metricsHelper;

    @Transactional(readOnly = true)
    public List<Owner> list() {
        log.debug("Listing owners");
        return ownerRepository.findAll();
    }

    @Transactional(readOnly = true)
    public ServiceResult<Owner> findById(Long ownerId) {
        log.debug("Getting owner: id={}", ownerId);
        return ownerRepository.findById(ownerId)
                .map(ServiceResult::success)
                .orElseGet(() -> ServiceResult.failure(ServiceError.notFound(ENTITY, ownerId)));
    }

    public ServiceResult<Owner> save(Owner owner) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "save", () -> {
            log.info("Creating owner: email={}", owner.getEmail());
            try {
                Owner saved = unitOfWork.complete(() -> ownerRepository.save(owner));
                log.info("Owner created: id={}", saved.getId());
                return ServiceResult.success(saved);
            } catch (DataAccessException | TransactionException e) {
                log.warn("Saving owner failed: {}", e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("saving", ENTITY, e));
            }
        });
    }

    /**
     * Replaces every field of an existing owner with the incoming values.
     *
     * @param ownerId the owner ID
     * @param owner incoming values
     * @return the updated owner, or NOT_FOUND with nothing written
     */
    public ServiceResult<Owner> update(Long ownerId, Owner owner) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "update", () -> {
            log.info("Updating owner: id={}", ownerId);
            try {
                return unitOfWork.complete(() -> {
                    Optional<Owner> found = ownerRepository.findById(ownerId);
                    if (found.isEmpty()) {
                        return ServiceResult.<Owner>failure(ServiceError.notFound(ENTITY, ownerId));
                    }
                    Owner existing = found.get();
                    existing.setFirstName(owner.getFirstName());
                    existing.setLastName(owner.getLastName());
                    existing.setEmail(owner.getEmail());
                    existing.setPhone(owner.getPhone());
                    return ServiceResult.success(ownerRepository.save(existing));
                });
            } catch (DataAccessException | TransactionException e) {
                log.warn("Updating owner failed: id={}, error={}", ownerId, e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("updating", ENTITY, e));
            }
        });
    }

    /**
     * Deletes an owner. Fails with CONFLICT while vehicles or agreements
     * still reference it.
     *
     * @param ownerId the owner ID
     * @return snapshot of the removed owner
     */
    public ServiceResult<Owner> delete(Long ownerId) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "delete", () -> {
            log.info("Deleting owner: id={}", ownerId);
            try {
                return unitOfWork.complete(() -> {
                    Optional<Owner> found = ownerRepository.findById(ownerId);
                    if (found.isEmpty()) {
                        return ServiceResult.<Owner>failure(ServiceError.notFound(ENTITY, ownerId));
                    }
                    ownerRepository.delete(found.get());
                    return ServiceResult.success(found.get());
                });
            } catch (DataAccessException | TransactionException e) {
                log.warn("Deleting owner failed: id={}, error={}", ownerId, e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("deleting", ENTITY, e));
            }
        });
    }
}
