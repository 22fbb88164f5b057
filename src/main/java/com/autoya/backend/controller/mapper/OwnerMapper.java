package com.autoya.backend.controller.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import com.autoya.backend.controller.dto.OwnerResource;
import com.autoya.backend.controller.dto.SaveOwnerRequest;
import com.autoya.backend.domain.Owner;

@Mapper(componentModel = "spring")
public interface OwnerMapper {

    OwnerResource toResource(Owner owner);

    List<OwnerResource> toResources(List<Owner> owners);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    Owner toEntity(SaveOwnerRequest request);
}
