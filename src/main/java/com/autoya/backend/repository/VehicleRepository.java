package com.autoya.backend.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.autoya.backend.domain.Vehicle;

/**
 * Repository for Vehicle entity.
 *
 * Besides plain CRUD it exposes lookups by each of the vehicle's references,
 * used by the filtered vehicle listing.
 */
@Repository
public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    /**
     * @param ownerId the owner ID
     * @return vehicles listed by the owner
     */
    List<Vehicle> findByOwnerId(Long ownerId);

    /**
     * @param renterId the renter ID
     * @return vehicles currently assigned to the renter
     */
    List<Vehicle> findByRenterId(Long renterId);

    /**
     * @param rentalId the rental agreement ID
     * @return vehicles attached to the agreement
     */
    List<Vehicle> findByRentalId(Long rentalId);
}
