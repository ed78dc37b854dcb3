package com.fintech.resolution.support;

import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.entity.Transaction;
import com.fintech.resolution.entity.TransactionStatus;
import com.fintech.resolution.matching.RankingParameters;
import com.fintech.resolution.matching.ScoreWeights;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixture builders shared by the unit tests.
 */
public final class TestData {

    public static final String USER = "user_001";

    private TestData() {
    }

    public static Merchant coffeePalace() {
        return Merchant.builder()
                .id("m_coffee")
                .canonicalName("Coffee Palace")
                .alias("CoffeePalace #112")
                .category("Food & Drink")
                .build();
    }

    public static Merchant amazon() {
        return Merchant.builder()
                .id("m_amazon")
                .canonicalName("Amazon")
                .alias("AMZN")
                .alias("AMZN Mktp")
                .category("Shopping")
                .build();
    }

    public static Merchant netflix() {
        return Merchant.builder()
                .id("m_netflix")
                .canonicalName("Netflix")
                .alias("NETFLIX.COM")
                .category("Entertainment")
                .build();
    }

    public static Map<String, Merchant> catalog(Merchant... merchants) {
        Map<String, Merchant> byId = new LinkedHashMap<>();
        for (Merchant merchant : merchants) {
            byId.put(merchant.getId(), merchant);
        }
        return byId;
    }

    public static Map<String, Merchant> catalog(Collection<Merchant> merchants) {
        return catalog(merchants.toArray(new Merchant[0]));
    }

    public static Transaction txn(String id, String amount, String date, String merchantId) {
        return txn(id, amount, date, merchantId, TransactionStatus.POSTED, null);
    }

    public static Transaction txn(String id, String amount, String date, String merchantId,
                                  TransactionStatus status, String category) {
        return Transaction.builder()
                .id(id)
                .userId(USER)
                .amount(new BigDecimal(amount))
                .currency("USD")
                .transactionDate(LocalDate.parse(date))
                .merchantId(merchantId)
                .status(status)
                .category(category)
                .description(id)
                .build();
    }

    public static RankingParameters defaultParameters() {
        return RankingParameters.builder()
                .amountTolerancePercent(10.0)
                .dateToleranceDays(3)
                .acceptanceThreshold(0.5)
                .ambiguityEpsilon(0.05)
                .maxCandidates(5)
                .partialMerchantScore(0.5)
                .weights(new ScoreWeights(0.15, 0.25, 0.60))
                .build();
    }
}
