package com.autoya.backend.service;

import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import com.autoya.backend.domain.Owner;
import com.autoya.backend.domain.RentalAgreement;
import com.autoya.backend.domain.Renter;
import com.autoya.backend.domain.Vehicle;
import com.autoya.backend.repository.OwnerRepository;
import com.autoya.backend.repository.RentalAgreementRepository;
import com.autoya.backend.repository.RenterRepository;
import com.autoya.backend.repository.UnitOfWork;
import com.autoya.backend.repository.VehicleRepository;
import com.autoya.backend.result.ErrorKind;
import com.autoya.backend.result.PersistenceFailures;
import com.autoya.backend.result.ServiceError;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.util.MetricsHelper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service for managing rental agreements (alquileres).
 *
 * Owner, renter and vehicle arrive from the controller as id-only
 * references; they are looked up and attached before every write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RentalAgreementService {

    static final String ENTITY = "Alquiler";
    private static final String METRIC_ENTITY = "rental";

    private final RentalAgreementRepository rentalAgreementRepository;
    private final OwnerRepository ownerRepository;
    private final RenterRepository renterRepository;
    private final VehicleRepository vehicleRepository;
    private final UnitOfWork unitOfWork;
    private final MetricsHelper metricsHelper;

    /**
     * Lists all agreements with their references loaded.
     *
     * @return all agreements ordered by id
     */
    @Transactional(readOnly = true)
    public List<RentalAgreement> list() {
        log.debug("Listing rental agreements");
        return rentalAgreementRepository.findAllWithReferences();
    }

    @Transactional(readOnly = true)
    public ServiceResult<RentalAgreement> findById(Long rentalId) {
        log.debug("Getting rental agreement: id={}", rentalId);
        return rentalAgreementRepository.findById(rentalId)
                .map(ServiceResult::success)
                .orElseGet(() -> ServiceResult.failure(ServiceError.notFound(ENTITY, rentalId)));
    }

    /**
     * Persists a new agreement.
     *
     * @param rental agreement mapped from the request
     * @return the saved agreement; NOT_FOUND when a referenced owner, renter
     *         or vehicle does not exist
     */
    public ServiceResult<RentalAgreement> save(RentalAgreement rental) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "save", () -> {
            log.info("Creating rental agreement: status={}, startDate={}, endDate={}, totalCost={}",
                    rental.getStatus(), rental.getStartDate(), rental.getEndDate(), rental.getTotalCost());

            Optional<ServiceError> invalid = validateDates(rental);
            if (invalid.isPresent()) {
                return ServiceResult.failure(invalid.get());
            }

            try {
                return unitOfWork.complete(() -> {
                    Optional<ServiceError> missing = attachReferences(rental, rental);
                    if (missing.isPresent()) {
                        return ServiceResult.<RentalAgreement>failure(missing.get());
                    }
                    RentalAgreement saved = rentalAgreementRepository.save(rental);
                    log.info("Rental agreement created: id={}", saved.getId());
                    return ServiceResult.success(saved);
                });
            } catch (DataAccessException | TransactionException e) {
                log.warn("Saving rental agreement failed: {}", e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("saving", ENTITY, e));
            }
        });
    }

    /**
     * Overwrites an existing agreement with the incoming values.
     *
     * @param rentalId the agreement ID
     * @param rental incoming values
     * @return the updated agreement, or NOT_FOUND with nothing written
     */
    public ServiceResult<RentalAgreement> update(Long rentalId, RentalAgreement rental) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "update", () -> {
            log.info("Updating rental agreement: id={}, status={}", rentalId, rental.getStatus());

            Optional<ServiceError> invalid = validateDates(rental);
            if (invalid.isPresent()) {
                return ServiceResult.failure(invalid.get());
            }

            try {
                return unitOfWork.complete(() -> {
                    Optional<RentalAgreement> found = rentalAgreementRepository.findById(rentalId);
                    if (found.isEmpty()) {
                        return ServiceResult.<RentalAgreement>failure(ServiceError.notFound(ENTITY, rentalId));
                    }
                    RentalAgreement existing = found.get();

                    // Resolve references first so a failed lookup leaves the row untouched
                    Optional<ServiceError> missing = attachReferences(rental, existing);
                    if (missing.isPresent()) {
                        return ServiceResult.<RentalAgreement>failure(missing.get());
                    }
                    existing.setStatus(rental.getStatus());
                    existing.setStartDate(rental.getStartDate());
                    existing.setEndDate(rental.getEndDate());
                    existing.setTotalCost(rental.getTotalCost());

                    RentalAgreement saved = rentalAgreementRepository.save(existing);
                    log.info("Rental agreement updated: id={}", saved.getId());
                    return ServiceResult.success(saved);
                });
            } catch (DataAccessException | TransactionException e) {
                log.warn("Updating rental agreement failed: id={}, error={}", rentalId, e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("updating", ENTITY, e));
            }
        });
    }

    /**
     * Deletes an agreement. Vehicles pointing at it are released by the
     * database (ON DELETE SET NULL).
     *
     * @param rentalId the agreement ID
     * @return snapshot of the removed agreement, or NOT_FOUND
     */
    public ServiceResult<RentalAgreement> delete(Long rentalId) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "delete", () -> {
            log.info("Deleting rental agreement: id={}", rentalId);
            try {
                return unitOfWork.complete(() -> {
                    Optional<RentalAgreement> found = rentalAgreementRepository.findById(rentalId);
                    if (found.isEmpty()) {
                        return ServiceResult.<RentalAgreement>failure(ServiceError.notFound(ENTITY, rentalId));
                    }
                    rentalAgreementRepository.delete(found.get());
                    log.info("Rental agreement deleted: id={}", rentalId);
                    return ServiceResult.success(found.get());
                });
            } catch (DataAccessException | TransactionException e) {
                log.warn("Deleting rental agreement failed: id={}, error={}", rentalId, e.getMessage());
                return ServiceResult.failure(PersistenceFailures.classify("deleting", ENTITY, e));
            }
        });
    }

    /**
     * Looks up the owner, renter and vehicle referenced by {@code source} and
     * sets them on {@code target}. Nothing is set unless all three exist.
     */
    private Optional<ServiceError> attachReferences(RentalAgreement source, RentalAgreement target) {
        Long ownerId = source.getOwner() != null ? source.getOwner().getId() : null;
        Long renterId = source.getRenter() != null ? source.getRenter().getId() : null;
        Long vehicleId = source.getVehicle() != null ? source.getVehicle().getId() : null;

        if (ownerId == null || renterId == null || vehicleId == null) {
            return Optional.of(ServiceError.of(ErrorKind.VALIDATION,
                    "An alquiler requires an owner, a renter and a vehicle.", ENTITY));
        }

        Optional<Owner> owner = ownerRepository.findById(ownerId);
        if (owner.isEmpty()) {
            return Optional.of(ServiceError.notFound(OwnerService.ENTITY, ownerId));
        }
        Optional<Renter> renter = renterRepository.findById(renterId);
        if (renter.isEmpty()) {
            return Optional.of(ServiceError.notFound(RenterService.ENTITY, renterId));
        }
        Optional<Vehicle> vehicle = vehicleRepository.findById(vehicleId);
        if (vehicle.isEmpty()) {
            return Optional.of(ServiceError.notFound(VehicleService.ENTITY, vehicleId));
        }

        target.setOwner(owner.get());
        target.setRenter(renter.get());
        target.setVehicle(vehicle.get());
        return Optional.empty();
    }

    private static Optional<ServiceError> validateDates(RentalAgreement rental) {
        if (rental.getStartDate() != null && rental.getEndDate() != null
                && rental.getEndDate().isBefore(rental.getStartDate())) {
            return Optional.of(ServiceError.of(ErrorKind.VALIDATION,
                    "End date must not be before start date.", ENTITY));
        }
        return Optional.empty();
    }
}
