package com.fintech.resolution.repository;

import com.fintech.resolution.entity.Dispute;
import com.fintech.resolution.entity.DisputeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, String> {

    List<Dispute> findByUserIdOrderByCreatedAtDesc(String userId);

    /**
     * Finds a dispute on the transaction that has not been closed yet.
     * Used to refuse duplicate filings.
     */
    Optional<Dispute> findFirstByTransactionIdAndStatusNot(String transactionId, DisputeStatus status);
}
