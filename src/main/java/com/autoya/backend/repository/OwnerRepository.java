package com.autoya.backend.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.autoya.backend.domain.Owner;

/**
 * Repository for Owner entity.
 */
@Repository
public interface OwnerRepository extends JpaRepository<Owner, Long> {
}
