package com.autoya.backend.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import com.autoya.backend.domain.RentalAgreement;

/**
 * Repository for RentalAgreement entity.
 */
@Repository
public interface RentalAgreementRepository extends JpaRepository<RentalAgreement, Long> {

    /**
     * Lists every agreement ordered by id.
     *
     * Owner, renter and vehicle are fetched in the same query so that the
     * resource mapping only touches loaded rows.
     *
     * @return all agreements
     */
    @Query("SELECT r FROM RentalAgreement r " +
           "JOIN FETCH r.owner " +
           "JOIN FETCH r.renter " +
           "JOIN FETCH r.vehicle " +
           "ORDER BY r.id")
    List<RentalAgreement> findAllWithReferences();
}
