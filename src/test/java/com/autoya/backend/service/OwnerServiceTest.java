package com.autoya.backend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.Optional;
import java.util.function.Supplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import com.autoya.backend.domain.Owner;
import com.autoya.backend.repository.OwnerRepository;
import com.autoya.backend.repository.UnitOfWork;
import com.autoya.backend.result.ErrorKind;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.util.MetricsHelper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class OwnerServiceTest {

    @Mock
    private OwnerRepository ownerRepository;

    private OwnerService ownerService;

    @BeforeEach
    void setUp() {
        UnitOfWork inline = new UnitOfWork() {
            @Override
            public <T> T complete(Supplier<T> work) {
                return work.get();
            }
        };
        ownerService = new OwnerService(ownerRepository, inline, new MetricsHelper(new SimpleMeterRegistry()));
    }

    @Test
    void save_DuplicateEmail_ShouldReturnConflict() {
        // Given
        Owner owner = Owner.builder().firstName("Ana").lastName("Rojas").email("ana@autoya.pe").build();
        given(ownerRepository.save(owner))
            .willThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        // When
        ServiceResult<Owner> result = ownerService.save(owner);

        // Then
        assertThat(result.getError().kind()).isEqualTo(ErrorKind.CONFLICT);
        assertThat(result.getMessage()).startsWith("An error occurred while saving the propietario: ");
    }

    @Test
    void update_ShouldOverwriteEveryField() {
        // Given
        Owner existing = Owner.builder().id(1L).firstName("Ana").lastName("Rojas")
            .email("ana@autoya.pe").phone("999").build();
        Owner changes = Owner.builder().firstName("Ana Maria").lastName("Rojas").email("am@autoya.pe").build();
        given(ownerRepository.findById(1L)).willReturn(Optional.of(existing));
        given(ownerRepository.save(existing)).willReturn(existing);

        // When
        ServiceResult<Owner> result = ownerService.update(1L, changes);

        // Then
        assertThat(result.getValue().getFirstName()).isEqualTo("Ana Maria");
        assertThat(result.getValue().getEmail()).isEqualTo("am@autoya.pe");
        assertThat(result.getValue().getPhone()).isNull();
    }

    @Test
    void delete_MissingOwner_ShouldFailWithoutRemoving() {
        // Given
        given(ownerRepository.findById(9L)).willReturn(Optional.empty());

        // When
        ServiceResult<Owner> result = ownerService.delete(9L);

        // Then
        assertThat(result.getMessage()).isEqualTo("Propietario not found.");
        verify(ownerRepository, never()).delete(any());
    }

    @Test
    void findById_MissingOwner_ShouldReturnNotFound() {
        // Given
        given(ownerRepository.findById(9L)).willReturn(Optional.empty());

        // When & Then
        assertThat(ownerService.findById(9L).getError().kind()).isEqualTo(ErrorKind.NOT_FOUND);
    }
}
