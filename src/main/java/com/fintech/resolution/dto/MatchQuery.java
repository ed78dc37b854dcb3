package com.fintech.resolution.dto;

import com.fintech.resolution.audit.Hashing;
import com.fintech.resolution.entity.TransactionStatus;
import com.fintech.resolution.exception.InvalidQueryException;
import com.fintech.resolution.matching.ScoreDimension;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Structured description of a transaction the user does not recognize.
 * <p>
 * Produced by the conversation layer from the user's message. Every field is
 * optional but at least one of amount, date, merchant text or transaction id
 * must be present. Category and status only narrow the search; they do not
 * identify a transaction on their own.
 */
@Value
@Builder(toBuilder = true)
public class MatchQuery {

    BigDecimal amount;
    LocalDate date;
    String merchantText;
    String transactionId;

    String category;
    TransactionStatus status;

    public boolean hasAmount() {
        return amount != null;
    }

    public boolean hasDate() {
        return date != null;
    }

    public boolean hasMerchantText() {
        return merchantText != null && !merchantText.isBlank();
    }

    public boolean hasTransactionId() {
        return transactionId != null && !transactionId.isBlank();
    }

    /**
     * Scoring dimensions this query carries a value for.
     */
    public Set<ScoreDimension> presentDimensions() {
        Set<ScoreDimension> present = EnumSet.noneOf(ScoreDimension.class);
        if (hasAmount()) {
            present.add(ScoreDimension.AMOUNT);
        }
        if (hasDate()) {
            present.add(ScoreDimension.DATE);
        }
        if (hasMerchantText()) {
            present.add(ScoreDimension.MERCHANT);
        }
        return present;
    }

    /**
     * Rejects queries that cannot identify anything.
     *
     * @throws InvalidQueryException if no identifying field is set or the amount is not positive
     */
    public void validate() {
        if (!hasAmount() && !hasDate() && !hasMerchantText() && !hasTransactionId()) {
            throw new InvalidQueryException(
                    "Query needs at least one of amount, date, merchant or transaction id");
        }
        if (hasAmount() && amount.signum() <= 0) {
            throw new InvalidQueryException("Amount must be positive");
        }
    }

    /**
     * Stable short digest of the identifying fields. Lets logs and pending state
     * refer to a query without carrying the merchant text around.
     */
    public String fingerprint() {
        String canonical = String.join("|",
                hasAmount() ? amount.stripTrailingZeros().toPlainString() : "",
                hasDate() ? date.toString() : "",
                hasMerchantText() ? merchantText.trim().toLowerCase(Locale.ROOT) : "",
                hasTransactionId() ? transactionId.trim() : "",
                category == null ? "" : category,
                status == null ? "" : status.name());
        return Hashing.shortSha256(canonical);
    }
}
