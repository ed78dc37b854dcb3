package com.fintech.resolution.dto;

import com.fintech.resolution.exception.InvalidQueryException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The user's answer to a clarification. Exactly one field must be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectionRequest {

    /** 1-based reference from the clarification list. */
    @Min(1)
    private Integer reference;

    @Size(max = 64)
    private String transactionId;

    @Valid
    private MatchQueryRequest refinedQuery;

    public Selection toSelection() {
        int set = (reference != null ? 1 : 0)
                + (transactionId != null && !transactionId.isBlank() ? 1 : 0)
                + (refinedQuery != null ? 1 : 0);
        if (set != 1) {
            throw new InvalidQueryException("Exactly one of reference, transactionId or refinedQuery is required");
        }
        if (reference != null) {
            return Selection.byRank(reference);
        }
        if (refinedQuery != null) {
            return Selection.refine(refinedQuery.toQuery());
        }
        return Selection.byTransactionId(transactionId.trim());
    }
}
