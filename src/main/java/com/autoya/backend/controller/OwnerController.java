package com.autoya.backend.controller;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.autoya.backend.controller.dto.OwnerResource;
import com.autoya.backend.controller.dto.SaveOwnerRequest;
import com.autoya.backend.controller.mapper.OwnerMapper;
import com.autoya.backend.domain.Owner;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.service.OwnerService;
import com.autoya.backend.util.ErrorResponseFactory;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for vehicle owners (propietarios).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/propietarios")
@RequiredArgsConstructor
@Tag(name = "Propietarios", description = "Owner CRUD")
public class OwnerController {

    private final OwnerService ownerService;
    private final OwnerMapper ownerMapper;
    private final ErrorResponseFactory errorResponseFactory;

    @GetMapping
    @Timed(value = "api.owners.list", description = "Time taken to list owners")
    @Operation(summary = "List owners")
    public List<OwnerResource> getAll() {
        return ownerMapper.toResources(ownerService.list());
    }

    @GetMapping("/{id}")
    @Timed(value = "api.owners.get", description = "Time taken to get an owner")
    @Operation(summary = "Get an owner by id")
    public ResponseEntity<Object> getById(@PathVariable Long id, HttpServletRequest request) {
        return respond(ownerService.findById(id), request);
    }

    @PostMapping
    @Timed(value = "api.owners.create", description = "Time taken to create an owner")
    @Operation(summary = "Create an owner")
    public ResponseEntity<Object> create(@Valid @RequestBody SaveOwnerRequest resource, HttpServletRequest request) {
        log.info("POST /api/v1/propietarios: email={}", resource.email());
        Owner owner = ownerMapper.toEntity(resource);
        return respond(ownerService.save(owner), request);
    }

    @PutMapping("/{id}")
    @Timed(value = "api.owners.update", description = "Time taken to update an owner")
    @Operation(summary = "Replace an owner")
    public ResponseEntity<Object> update(
            @PathVariable Long id,
            @Valid @RequestBody SaveOwnerRequest resource,
            HttpServletRequest request
    ) {
        log.info("PUT /api/v1/propietarios/{}", id);
        Owner owner = ownerMapper.toEntity(resource);
        return respond(ownerService.update(id, owner), request);
    }

    @DeleteMapping("/{id}")
    @Timed(value = "api.owners.delete", description = "Time taken to delete an owner")
    @Operation(summary = "Delete an owner", description = "Fails while vehicles or agreements reference the owner")
    public ResponseEntity<Object> delete(@PathVariable Long id, HttpServletRequest request) {
        log.info("DELETE /api/v1/propietarios/{}", id);
        return respond(ownerService.delete(id), request);
    }

    private ResponseEntity<Object> respond(ServiceResult<Owner> result, HttpServletRequest request) {
        if (!result.isSuccess()) {
            log.warn("{} {} failed: {}", request.getMethod(), request.getRequestURI(), result.getMessage());
            return errorResponseFactory.fromServiceError(result.getError(), request.getRequestURI());
        }
        return ResponseEntity.ok(ownerMapper.toResource(result.getValue()));
    }
}
