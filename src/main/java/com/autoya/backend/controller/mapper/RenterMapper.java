package com.autoya.backend.controller.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import com.autoya.backend.controller.dto.RenterResource;
import com.autoya.backend.controller.dto.SaveRenterRequest;
import com.autoya.backend.domain.Renter;

@Mapper(componentModel = "spring")
public interface RenterMapper {

    RenterResource toResource(Renter renter);

    List<RenterResource> toResources(List<Renter> renters);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    Renter toEntity(SaveRenterRequest request);
}
