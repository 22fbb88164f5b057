package com.autoya.backend.controller.mapper;

import org.springframework.stereotype.Component;

import com.autoya.backend.domain.Owner;
import com.autoya.backend.domain.RentalAgreement;
import com.autoya.backend.domain.Renter;
import com.autoya.backend.domain.Vehicle;

/**
 * Turns foreign-key ids from request bodies into id-only entity references.
 *
 * The services replace these placeholders with the stored rows, failing with
 * NOT_FOUND when a row does not exist.
 */
@Component
public class ReferenceMapper {

    public Owner toOwner(Long id) {
        return id == null ? null : Owner.builder().id(id).build();
    }

    public Renter toRenter(Long id) {
        return id == null ? null : Renter.builder().id(id).build();
    }

    public Vehicle toVehicle(Long id) {
        return id == null ? null : Vehicle.builder().id(id).build();
    }

    public RentalAgreement toRental(Long id) {
        return id == null ? null : RentalAgreement.builder().id(id).build();
    }
}
