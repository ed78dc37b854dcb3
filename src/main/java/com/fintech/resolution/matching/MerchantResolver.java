package com.fintech.resolution.matching;

import com.fintech.resolution.entity.Merchant;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps free merchant text ("amzn mktp", "Coffee Palace") to merchant records.
 * <p>
 * Comparison is case-insensitive and ignores surrounding and repeated
 * whitespace. Canonical-name matches always rank above alias matches, which
 * rank above substring matches.
 */
@Component
public class MerchantResolver {

    /** Shorter text is too unspecific for substring matching ("a", "co"). */
    static final int MIN_PARTIAL_LENGTH = 3;

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public MerchantMatchType matchType(String text, Merchant merchant) {
        String query = normalize(text);
        if (query.isEmpty() || merchant == null) {
            return MerchantMatchType.NONE;
        }
        String canonical = normalize(merchant.getCanonicalName());
        if (query.equals(canonical)) {
            return MerchantMatchType.CANONICAL_NAME;
        }
        for (String alias : merchant.getAliases()) {
            if (query.equals(normalize(alias))) {
                return MerchantMatchType.ALIAS;
            }
        }
        if (query.length() >= MIN_PARTIAL_LENGTH) {
            if (containsEitherWay(query, canonical)) {
                return MerchantMatchType.PARTIAL;
            }
            for (String alias : merchant.getAliases()) {
                if (containsEitherWay(query, normalize(alias))) {
                    return MerchantMatchType.PARTIAL;
                }
            }
        }
        return MerchantMatchType.NONE;
    }

    /**
     * Exact matches only: canonical-name matches first, then alias-only matches.
     * Returns an empty list when nothing matches.
     */
    public List<Merchant> resolve(String text, Collection<Merchant> catalog) {
        return collect(text, catalog, false);
    }

    /**
     * Like {@link #resolve} but also returns substring matches, after the exact ones.
     * Used for the direct "who is this merchant" lookup.
     */
    public List<Merchant> search(String text, Collection<Merchant> catalog) {
        return collect(text, catalog, true);
    }

    private List<Merchant> collect(String text, Collection<Merchant> catalog, boolean includePartial) {
        Map<Merchant, MerchantMatchType> hits = new HashMap<>();
        for (Merchant merchant : catalog) {
            MerchantMatchType type = matchType(text, merchant);
            if (type == MerchantMatchType.NONE || (type == MerchantMatchType.PARTIAL && !includePartial)) {
                continue;
            }
            hits.put(merchant, type);
        }
        List<Merchant> merchants = new ArrayList<>(hits.keySet());
        merchants.sort(Comparator.comparing((Merchant m) -> hits.get(m))
                .thenComparing(Merchant::getCanonicalName, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(Merchant::getId));
        return merchants;
    }

    private static boolean containsEitherWay(String query, String name) {
        return !name.isEmpty() && (name.contains(query) || query.contains(name));
    }
}
