package com.autoya.backend.controller.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import com.autoya.backend.controller.dto.RentalAgreementResource;
import com.autoya.backend.controller.dto.SaveRentalAgreementRequest;
import com.autoya.backend.domain.RentalAgreement;

/**
 * Maps rental agreements to and from their wire shapes.
 */
@Mapper(componentModel = "spring", uses = ReferenceMapper.class)
public interface RentalAgreementMapper {

    @Mapping(source = "owner.id", target = "ownerId")
    @Mapping(source = "renter.id", target = "renterId")
    @Mapping(source = "vehicle.id", target = "vehicleId")
    RentalAgreementResource toResource(RentalAgreement rental);

    List<RentalAgreementResource> toResources(List<RentalAgreement> rentals);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(source = "ownerId", target = "owner")
    @Mapping(source = "renterId", target = "renter")
    @Mapping(source = "vehicleId", target = "vehicle")
    RentalAgreement toEntity(SaveRentalAgreementRequest request);
}
