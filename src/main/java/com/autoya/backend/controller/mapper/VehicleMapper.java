package com.autoya.backend.controller.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import com.autoya.backend.controller.dto.SaveVehicleRequest;
import com.autoya.backend.controller.dto.VehicleResource;
import com.autoya.backend.domain.Vehicle;

/**
 * Maps vehicles to and from their wire shapes.
 *
 * Partial updates do not go through here, see {@link VehiclePatchMapper}.
 */
@Mapper(componentModel = "spring", uses = ReferenceMapper.class)
public interface VehicleMapper {

    @Mapping(source = "owner.id", target = "ownerId")
    @Mapping(source = "renter.id", target = "renterId")
    @Mapping(source = "rental.id", target = "rentalId")
    VehicleResource toResource(Vehicle vehicle);

    List<VehicleResource> toResources(List<Vehicle> vehicles);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(source = "ownerId", target = "owner")
    @Mapping(source = "renterId", target = "renter")
    @Mapping(source = "rentalId", target = "rental")
    Vehicle toEntity(SaveVehicleRequest request);
}
