package com.autoya.backend.service;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import com.autoya.backend.domain.Owner;
import com.autoya.backend.domain.ReferenceUpdate;
import com.autoya.backend.domain.RentalAgreement;
import com.autoya.backend.domain.Renter;
import com.autoya.backend.domain.Vehicle;
import com.autoya.backend.domain.VehiclePatch;
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
 * Service for managing vehicles.
 *
 * Updates are partial: only the fields present in a {@link VehiclePatch} are
 * written, the rest of the stored record is kept. The whole record is then
 * rewritten in one unit of work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VehicleService {

    static final String ENTITY = "Vehiculo";
    private static final String METRIC_ENTITY = "vehicle";

    private final VehicleRepository vehicleRepository;
    private final OwnerRepository ownerRepository;
    private final RenterRepository renterRepository;
    private final RentalAgreementRepository rentalAgreementRepository;
    private final UnitOfWork unitOfWork;
    private final MetricsHelper metricsHelper;

    @Transactional(readOnly = true)
    public List<Vehicle> list() {
        log.debug("Listing vehicles");
        return vehicleRepository.findAll();
    }

    @Transactional(readOnly = true)
    public List<Vehicle> listByOwnerId(Long ownerId) {
        log.debug("Listing vehicles: ownerId={}", ownerId);
        return vehicleRepository.findByOwnerId(ownerId);
    }

    @Transactional(readOnly = true)
    public List<Vehicle> listByRenterId(Long renterId) {
        log.debug("Listing vehicles: renterId={}", renterId);
        return vehicleRepository.findByRenterId(renterId);
    }

    @Transactional(readOnly = true)
    public List<Vehicle> listByRentalId(Long rentalId) {
        log.debug("Listing vehicles: rentalId={}", rentalId);
        return vehicleRepository.findByRentalId(rentalId);
    }

    @Transactional(readOnly = true)
    public ServiceResult<Vehicle> findById(Long vehicleId) {
        log.debug("Getting vehicle: id={}", vehicleId);
        return vehicleRepository.findById(vehicleId)
                .map(ServiceResult::success)
                .orElseGet(() -> ServiceResult.failure(ServiceError.notFound(ENTITY, vehicleId)));
    }

    /**
     * Persists a new vehicle.
     *
     * The owner (and renter/rental, if set) arrive as id-only references and
     * are replaced with the stored rows before saving.
     *
     * @param vehicle vehicle mapped from the request
     * @return the saved vehicle, or NOT_FOUND / CONFLICT / INTERNAL
     */
    public ServiceResult<Vehicle> save(Vehicle vehicle) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "save", () -> doSave(vehicle));
    }

    private ServiceResult<Vehicle> doSave(Vehicle vehicle) {
        log.info("Creating vehicle: brand={}, model={}, ownerId={}",
                vehicle.getBrand(), vehicle.getModel(), idOf(vehicle.getOwner()));

        try {
            if (idOf(vehicle.getOwner()) == null) {
                return ServiceResult.failure(ServiceError.of(ErrorKind.VALIDATION, "A vehiculo requires an owner.", ENTITY));
            }
            return unitOfWork.complete(() -> {
                Optional<Owner> owner = ownerRepository.findById(idOf(vehicle.getOwner()));
                if (owner.isEmpty()) {
                    return ServiceResult.failure(ServiceError.notFound(OwnerService.ENTITY, idOf(vehicle.getOwner())));
                }
                vehicle.setOwner(owner.get());

                Optional<ServiceError> missing = attachOptionalReferences(vehicle);
                if (missing.isPresent()) {
                    return ServiceResult.failure(missing.get());
                }

                Vehicle saved = vehicleRepository.save(vehicle);
                log.info("Vehicle created: id={}", saved.getId());
                return ServiceResult.success(saved);
            });
        } catch (DataAccessException | TransactionException e) {
            log.warn("Saving vehicle failed: {}", e.getMessage());
            return ServiceResult.failure(PersistenceFailures.classify("saving", ENTITY, e));
        }
    }

    /**
     * Applies a partial update to an existing vehicle.
     *
     * References are resolved before any field is touched, so a failed lookup
     * leaves the stored row untouched.
     *
     * @param vehicleId the vehicle ID
     * @param patch fields to change
     * @return the merged vehicle, or a failure; NOT_FOUND when the vehicle
     *         does not exist, in which case nothing is written
     */
    public ServiceResult<Vehicle> update(Long vehicleId, VehiclePatch patch) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "update", () -> doUpdate(vehicleId, patch));
    }

    private ServiceResult<Vehicle> doUpdate(Long vehicleId, VehiclePatch patch) {
        log.info("Updating vehicle: id={}, patch={}", vehicleId, patch);

        try {
            return unitOfWork.complete(() -> {
                Optional<Vehicle> found = vehicleRepository.findById(vehicleId);
                if (found.isEmpty()) {
                    return ServiceResult.failure(ServiceError.notFound(ENTITY, vehicleId));
                }
                Vehicle existing = found.get();

                Optional<Renter> renter = Optional.empty();
                if (patch.getRenter().getMode() == ReferenceUpdate.Mode.ASSIGN) {
                    renter = renterRepository.findById(patch.getRenter().getId());
                    if (renter.isEmpty()) {
                        return ServiceResult.failure(
                                ServiceError.notFound(RenterService.ENTITY, patch.getRenter().getId()));
                    }
                }

                Optional<RentalAgreement> rental = Optional.empty();
                if (patch.getRental().getMode() == ReferenceUpdate.Mode.ASSIGN) {
                    rental = rentalAgreementRepository.findById(patch.getRental().getId());
                    if (rental.isEmpty()) {
                        return ServiceResult.failure(
                                ServiceError.notFound(RentalAgreementService.ENTITY, patch.getRental().getId()));
                    }
                }

                patch.applyScalarsTo(existing);
                applyReference(patch.getRenter(), renter, existing::setRenter);
                applyReference(patch.getRental(), rental, existing::setRental);

                Vehicle saved = vehicleRepository.save(existing);
                log.info("Vehicle updated: id={}", saved.getId());
                return ServiceResult.success(saved);
            });
        } catch (DataAccessException | TransactionException e) {
            log.warn("Updating vehicle failed: id={}, error={}", vehicleId, e.getMessage());
            return ServiceResult.failure(PersistenceFailures.classify("updating", ENTITY, e));
        }
    }

    /**
     * Deletes a vehicle.
     *
     * @param vehicleId the vehicle ID
     * @return snapshot of the removed vehicle, or NOT_FOUND with nothing removed
     */
    public ServiceResult<Vehicle> delete(Long vehicleId) {
        return metricsHelper.recordOperation(METRIC_ENTITY, "delete", () -> doDelete(vehicleId));
    }

    private ServiceResult<Vehicle> doDelete(Long vehicleId) {
        log.info("Deleting vehicle: id={}", vehicleId);

        try {
            return unitOfWork.complete(() -> {
                Optional<Vehicle> found = vehicleRepository.findById(vehicleId);
                if (found.isEmpty()) {
                    return ServiceResult.failure(ServiceError.notFound(ENTITY, vehicleId));
                }
                vehicleRepository.delete(found.get());
                log.info("Vehicle deleted: id={}", vehicleId);
                return ServiceResult.success(found.get());
            });
        } catch (DataAccessException | TransactionException e) {
            log.warn("Deleting vehicle failed: id={}, error={}", vehicleId, e.getMessage());
            return ServiceResult.failure(PersistenceFailures.classify("deleting", ENTITY, e));
        }
    }

    private Optional<ServiceError> attachOptionalReferences(Vehicle vehicle) {
        if (vehicle.getRenter() != null) {
            Long renterId = idOf(vehicle.getRenter());
            Optional<Renter> renter = renterRepository.findById(renterId);
            if (renter.isEmpty()) {
                return Optional.of(ServiceError.notFound(RenterService.ENTITY, renterId));
            }
            vehicle.setRenter(renter.get());
        }
        if (vehicle.getRental() != null) {
            Long rentalId = idOf(vehicle.getRental());
            Optional<RentalAgreement> rental = rentalAgreementRepository.findById(rentalId);
            if (rental.isEmpty()) {
                return Optional.of(ServiceError.notFound(RentalAgreementService.ENTITY, rentalId));
            }
            vehicle.setRental(rental.get());
        }
        return Optional.empty();
    }

    private static <T> void applyReference(ReferenceUpdate update, Optional<T> resolved,
                                           Consumer<T> setter) {
        switch (update.getMode()) {
            case ASSIGN:
                setter.accept(resolved.orElseThrow());
                break;
            case CLEAR:
                setter.accept(null);
                break;
            default:
                break;
        }
    }

    private static Long idOf(Owner owner) {
        return owner != null ? owner.getId() : null;
    }

    private static Long idOf(Renter renter) {
        return renter != null ? renter.getId() : null;
    }

    private static Long idOf(RentalAgreement rental) {
        return rental != null ? rental.getId() : null;
    }
}
