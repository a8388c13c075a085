package com.openfashion.vaultservice.repository;

import com.openfashion.vaultservice.model.VaultEvent;
import com.openfashion.vaultservice.model.VaultEventType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VaultEventRepository extends JpaRepository<VaultEvent, Long> {

    @Query(value = """
    SELECT * FROM vault_events
    WHERE status = 'PENDING'
    ORDER BY id
    LIMIT :limit
    FOR UPDATE SKIP LOCKED
    """, nativeQuery = true)
    List<VaultEvent> findTopForProcessing(@Param("limit") int limit);

    List<VaultEvent> findAllByIdGreaterThanOrderByIdAsc(Long afterId, Pageable pageable);

    List<VaultEvent> findAllByTypeOrderByIdAsc(VaultEventType type);
}
