package com.autoya.backend.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.autoya.backend.domain.Renter;

/**
 * Repository for Renter entity.
 */
@Repository
public interface RenterRepository extends JpaRepository<Renter, Long> {
}
