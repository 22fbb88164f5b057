package com.autoya.backend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
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

import com.autoya.backend.domain.Renter;
import com.autoya.backend.repository.RenterRepository;
import com.autoya.backend.repository.UnitOfWork;
import com.autoya.backend.result.ErrorKind;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.util.MetricsHelper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class RenterServiceTest {

    @Mock
    private RenterRepository renterRepository;

    @Mock
    private UnitOfWork unitOfWork;

    private RenterService renterService;

    @BeforeEach
    void setUp() {
        given(unitOfWork.complete(any())).willAnswer(inv -> inv.<Supplier<?>>getArgument(0).get());
        renterService = new RenterService(renterRepository, unitOfWork, new MetricsHelper(new SimpleMeterRegistry()));
    }

    @Test
    void delete_RenterWithAgreements_ShouldReturnConflict() {
        // Given
        Renter renter = Renter.builder().id(2L).email("luis@autoya.pe").build();
        given(renterRepository.findById(2L)).willReturn(Optional.of(renter));
        willThrow(new DataIntegrityViolationException("rental_agreements_renter_id_fkey"))
            .given(renterRepository).delete(renter);

        // When
        ServiceResult<Renter> result = renterService.delete(2L);

        // Then
        assertThat(result.getError().kind()).isEqualTo(ErrorKind.CONFLICT);
        assertThat(result.getMessage())
            .isEqualTo("An error occurred while deleting the arrendatario: rental_agreements_renter_id_fkey");
    }

    @Test
    void update_MissingRenter_ShouldFailWithoutWriting() {
        // Given
        given(renterRepository.findById(2L)).willReturn(Optional.empty());

        // When
        ServiceResult<Renter> result = renterService.update(2L, Renter.builder().email("x@autoya.pe").build());

        // Then
        assertThat(result.getMessage()).isEqualTo("Arrendatario not found.");
        verify(renterRepository, never()).save(any());
    }
}
