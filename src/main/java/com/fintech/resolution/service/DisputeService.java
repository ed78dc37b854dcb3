package com.fintech.resolution.service;

import com.fintech.resolution.audit.AuditLogger;
import com.fintech.resolution.entity.Dispute;
import com.fintech.resolution.entity.DisputeStatus;
import com.fintech.resolution.entity.Transaction;
import com.fintech.resolution.exception.DisputeConflictException;
import com.fintech.resolution.exception.InvalidQueryException;
import com.fintech.resolution.exception.NotFoundException;
import com.fintech.resolution.repository.DisputeRepository;
import com.fintech.resolution.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Files and reads disputes once a transaction has been identified.
 * Users only ever see their own transactions and disputes; anything else is
 * reported as not found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisputeService {

    static final int MAX_COMPLAINT_LENGTH = 2000;

    private final DisputeRepository disputeRepository;
    private final TransactionRepository transactionRepository;
    private final AuditLogger auditLogger;

    /**
     * Flags a transaction for human review.
     *
     * @throws NotFoundException        if the transaction does not exist or belongs to another user
     * @throws DisputeConflictException if an unresolved dispute already exists for the transaction
     */
    @Transactional
    public Dispute flagForReview(String userId, String transactionId, String complaint) {
        if (complaint == null || complaint.isBlank()) {
            throw new InvalidQueryException("Complaint text is required");
        }
        if (complaint.length() > MAX_COMPLAINT_LENGTH) {
            throw new InvalidQueryException("Complaint must be at most " + MAX_COMPLAINT_LENGTH + " characters");
        }

        Transaction transaction = transactionRepository.findByIdAndUserId(transactionId, userId)
                .orElseThrow(() -> new NotFoundException("Transaction", transactionId));

        disputeRepository.findFirstByTransactionIdAndStatusNot(transaction.getId(), DisputeStatus.RESOLVED)
                .ifPresent(existing -> {
                    log.warn("Refusing duplicate dispute on transaction {}: {} is still {}",
                            transaction.getId(), existing.getId(), existing.getStatus());
                    throw new DisputeConflictException(transaction.getId(), existing.getId());
                });

        Dispute dispute = disputeRepository.save(Dispute.builder()
                .transactionId(transaction.getId())
                .userId(userId)
                .complaint(complaint.trim())
                .build());

        log.info("Dispute {} filed for transaction {}", dispute.getId(), transaction.getId());
        auditLogger.disputeFlagged(userId, transaction.getId(), dispute.getId());
        return dispute;
    }

    @Transactional(readOnly = true)
    public Dispute getDispute(String userId, String disputeId) {
        return disputeRepository.findById(disputeId)
                .filter(dispute -> dispute.getUserId().equals(userId))
                .orElseThrow(() -> new NotFoundException("Dispute", disputeId));
    }

    /**
     * Newest first.
     */
    @Transactional(readOnly = true)
    public List<Dispute> listDisputes(String userId) {
        return disputeRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }
}
