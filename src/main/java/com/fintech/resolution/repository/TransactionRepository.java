package com.fintech.resolution.repository;

import com.fintech.resolution.entity.Transaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the ledger, always scoped to a single user.
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, String> {

    /**
     * Full snapshot of one user's transactions. Matching runs against this list.
     */
    List<Transaction> findByUserId(String userId);

    /**
     * Lookup that refuses to return another user's transaction.
     */
    Optional<Transaction> findByIdAndUserId(String id, String userId);
}
