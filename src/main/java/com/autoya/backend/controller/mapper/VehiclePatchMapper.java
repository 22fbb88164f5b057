package com.autoya.backend.controller.mapper;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.autoya.backend.controller.dto.UpdateVehicleRequest;
import com.autoya.backend.domain.ReferenceUpdate;
import com.autoya.backend.domain.VehiclePatch;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link VehiclePatch} from an update request.
 *
 * A null field means "not supplied". When placeholder handling is enabled
 * (autoya.api.update.ignore-placeholders, on by default) the values that
 * generated API clients send for untouched fields, the literal
 * {@value #PLACEHOLDER_STRING} and {@code 0}, are treated as not supplied too.
 * References: a release flag clears, an id reassigns, nothing keeps.
 */
@Slf4j
@Component
public class VehiclePatchMapper {

    static final String PLACEHOLDER_STRING = "string";

    private final boolean ignorePlaceholders;

    public VehiclePatchMapper(@Value("${autoya.api.update.ignore-placeholders:true}") boolean ignorePlaceholders) {
        this.ignorePlaceholders = ignorePlaceholders;
        log.info("Vehicle update placeholder handling: ignorePlaceholders={}", ignorePlaceholders);
    }

    public VehiclePatch toPatch(UpdateVehicleRequest request) {
        return VehiclePatch.builder()
            .brand(text(request.brand()))
            .model(text(request.model()))
            .topSpeed(number(request.topSpeed()))
            .consumption(number(request.consumption()))
            .dimensions(number(request.dimensions()))
            .weight(number(request.weight()))
            .vehicleClass(text(request.vehicleClass()))
            .transmission(text(request.transmission()))
            .rentalTime(number(request.rentalTime()))
            .rentalTimeUnit(text(request.rentalTimeUnit()))
            .rentalCost(number(request.rentalCost()))
            .pickupLocation(text(request.pickupLocation()))
            .imageUrl(text(request.imageUrl()))
            .contractPdf(text(request.contractPdf()))
            .rentalState(text(request.rentalState()))
            .renter(reference(request.releaseRenter(), request.renterId()))
            .rental(reference(request.releaseRental(), request.rentalId()))
            .build();
    }

    private String text(String value) {
        if (value == null || (ignorePlaceholders && PLACEHOLDER_STRING.equals(value))) {
            return null;
        }
        return value;
    }

    private Integer number(Integer value) {
        if (value == null || (ignorePlaceholders && value == 0)) {
            return null;
        }
        return value;
    }

    private ReferenceUpdate reference(Boolean release, Long id) {
        if (Boolean.TRUE.equals(release)) {
            return ReferenceUpdate.clear();
        }
        if (id == null || (ignorePlaceholders && id == 0L)) {
            return ReferenceUpdate.keep();
        }
        return ReferenceUpdate.assign(id);
    }
}
