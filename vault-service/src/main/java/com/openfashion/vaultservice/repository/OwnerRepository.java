package com.openfashion.vaultservice.repository;

import com.openfashion.vaultservice.model.Owner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OwnerRepository extends JpaRepository<Owner, Long> {

    Optional<Owner> findByAddress(String address);

    boolean existsByAddressAndActiveTrue(String address);

    List<Owner> findAllByActiveTrueOrderByIdAsc();

    long countByActiveTrue();
}
