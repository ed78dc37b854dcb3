package com.fintech.resolution.audit;

import com.fintech.resolution.dto.MatchOutcome;
import com.fintech.resolution.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Audit trail of resolution decisions and disputes.
 * <p>
 * Writes one key=value line per event to the {@code audit} logger so it can be
 * routed to its own appender. User ids are hashed; merchant text and complaint
 * text are never written.
 */
@Component
public class AuditLogger {

    private static final Logger audit = LoggerFactory.getLogger("audit");

    public void matchResolved(String userId, String sessionId, String queryFingerprint,
                              MatchOutcome outcome, int candidateCount) {
        audit.info("event=match_resolved user={} session={} query={} outcome={} candidates={}",
                Hashing.shortSha256(userId), sessionId, queryFingerprint, outcome, candidateCount);
    }

    public void clarificationRequested(String userId, String sessionId, String queryFingerprint,
                                       int candidateCount) {
        audit.info("event=clarification_requested user={} session={} query={} candidates={}",
                Hashing.shortSha256(userId), sessionId, queryFingerprint, candidateCount);
    }

    public void selectionResolved(String userId, String sessionId, String transactionId) {
        audit.info("event=selection_resolved user={} session={} transaction={}",
                Hashing.shortSha256(userId), sessionId, transactionId);
    }

    public void disputeFlagged(String userId, String transactionId, String disputeId) {
        audit.info("event=dispute_flagged user={} transaction={} dispute={}",
                Hashing.shortSha256(userId), transactionId, disputeId);
    }

    public void providerCallFailed(String providerId, ErrorKind kind) {
        audit.warn("event=provider_call_failed provider={} kind={}", providerId, kind);
    }
}
