package com.fintech.resolution.dto;

import com.fintech.resolution.entity.TransactionStatus;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Wire form of {@link MatchQuery}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchQueryRequest {

    @Positive
    private BigDecimal amount;

    /** ISO date, e.g. 2024-03-15. */
    private LocalDate date;

    @Size(max = 200)
    private String merchant;

    @Size(max = 64)
    private String transactionId;

    @Size(max = 50)
    private String category;

    private TransactionStatus status;

    public MatchQuery toQuery() {
        return MatchQuery.builder()
                .amount(amount)
                .date(date)
                .merchantText(merchant)
                .transactionId(transactionId)
                .category(category)
                .status(status)
                .build();
    }
}
