package com.autoya.backend.controller;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.autoya.backend.controller.dto.SaveVehicleRequest;
import com.autoya.backend.controller.dto.UpdateVehicleRequest;
import com.autoya.backend.controller.mapper.VehicleMapper;
import com.autoya.backend.controller.mapper.VehiclePatchMapper;
import com.autoya.backend.domain.Vehicle;
import com.autoya.backend.domain.VehiclePatch;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.service.VehicleService;
import com.autoya.backend.util.ErrorResponseFactory;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for vehicles (vehiculos).
 *
 * Endpoints:
 * - GET    /api/v1/vehiculos[?ownerId=|renterId=|rentalId=]
 * - GET    /api/v1/vehiculos/{id}
 * - POST   /api/v1/vehiculos
 * - PUT    /api/v1/vehiculos/{id} (partial update)
 * - DELETE /api/v1/vehiculos/{id}
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/vehiculos")
@RequiredArgsConstructor
@Tag(name = "Vehiculos", description = "Vehicle CRUD with partial updates")
public class VehicleController {

    private final VehicleService vehicleService;
    private final VehicleMapper vehicleMapper;
    private final VehiclePatchMapper vehiclePatchMapper;
    private final ErrorResponseFactory errorResponseFactory;

    @GetMapping
    @Timed(value = "api.vehicles.list", description = "Time taken to list vehicles")
    @Operation(summary = "List vehicles", description = "At most one of ownerId, renterId, rentalId may be given")
    public ResponseEntity<Object> getAll(
            @Parameter(description = "Only vehicles of this owner") @RequestParam(required = false) Long ownerId,
            @Parameter(description = "Only vehicles rented by this renter") @RequestParam(required = false) Long renterId,
            @Parameter(description = "Only vehicles under this agreement") @RequestParam(required = false) Long rentalId,
            HttpServletRequest request
    ) {
        int filters = (ownerId != null ? 1 : 0) + (renterId != null ? 1 : 0) + (rentalId != null ? 1 : 0);
        if (filters > 1) {
            log.warn("GET /api/v1/vehiculos rejected: ownerId={}, renterId={}, rentalId={}",
                    ownerId, renterId, rentalId);
            return ResponseEntity.badRequest().body(errorResponseFactory.createErrorBody(
                    HttpStatus.BAD_REQUEST, "VALIDATION",
                    "Only one of ownerId, renterId, rentalId may be given.", request.getRequestURI()));
        }

        List<Vehicle> vehicles;
        if (ownerId != null) {
            vehicles = vehicleService.listByOwnerId(ownerId);
        } else if (renterId != null) {
            vehicles = vehicleService.listByRenterId(renterId);
        } else if (rentalId != null) {
            vehicles = vehicleService.listByRentalId(rentalId);
        } else {
            vehicles = vehicleService.list();
        }
        log.debug("GET /api/v1/vehiculos: count={}", vehicles.size());
        return ResponseEntity.ok(vehicleMapper.toResources(vehicles));
    }

    @GetMapping("/{id}")
    @Timed(value = "api.vehicles.get", description = "Time taken to get a vehicle")
    @Operation(summary = "Get a vehicle by id")
    public ResponseEntity<Object> getById(@PathVariable Long id, HttpServletRequest request) {
        return respond(vehicleService.findById(id), request);
    }

    @PostMapping
    @Timed(value = "api.vehicles.create", description = "Time taken to create a vehicle")
    @Operation(summary = "Create a vehicle")
    public ResponseEntity<Object> create(@Valid @RequestBody SaveVehicleRequest resource, HttpServletRequest request) {
        log.info("POST /api/v1/vehiculos: brand={}, model={}, ownerId={}",
                resource.brand(), resource.model(), resource.ownerId());

        Vehicle vehicle = vehicleMapper.toEntity(resource);
        return respond(vehicleService.save(vehicle), request);
    }

    @PutMapping("/{id}")
    @Timed(value = "api.vehicles.update", description = "Time taken to update a vehicle")
    @Operation(summary = "Partially update a vehicle", description = "Omitted fields keep their stored value")
    public ResponseEntity<Object> update(
            @PathVariable Long id,
            @Valid @RequestBody UpdateVehicleRequest resource,
            HttpServletRequest request
    ) {
        log.info("PUT /api/v1/vehiculos/{}", id);

        VehiclePatch patch = vehiclePatchMapper.toPatch(resource);
        return respond(vehicleService.update(id, patch), request);
    }

    @DeleteMapping("/{id}")
    @Timed(value = "api.vehicles.delete", description = "Time taken to delete a vehicle")
    @Operation(summary = "Delete a vehicle", description = "Returns the deleted vehicle")
    public ResponseEntity<Object> delete(@PathVariable Long id, HttpServletRequest request) {
        log.info("DELETE /api/v1/vehiculos/{}", id);
        return respond(vehicleService.delete(id), request);
    }

    private ResponseEntity<Object> respond(ServiceResult<Vehicle> result, HttpServletRequest request) {
        if (!result.isSuccess()) {
            log.warn("{} {} failed: {}", request.getMethod(), request.getRequestURI(), result.getMessage());
            return errorResponseFactory.fromServiceError(result.getError(), request.getRequestURI());
        }
        return ResponseEntity.ok(vehicleMapper.toResource(result.getValue()));
    }
}
