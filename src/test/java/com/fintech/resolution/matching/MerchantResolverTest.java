package com.fintech.resolution.matching;

import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.support.TestData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MerchantResolverTest {

    private final MerchantResolver resolver = new MerchantResolver();

    private final List<Merchant> catalog = List.of(TestData.coffeePalace(), TestData.amazon(), TestData.netflix());

    @Test
    @DisplayName("Resolves canonical name ignoring case and extra whitespace")
    void canonicalName() {
        assertThat(resolver.resolve("  coffee   PALACE ", catalog))
                .extracting(Merchant::getId)
                .containsExactly("m_coffee");
    }

    @Test
    @DisplayName("Resolves statement aliases")
    void alias() {
        assertThat(resolver.resolve("netflix.com", catalog))
                .extracting(Merchant::getId)
                .containsExactly("m_netflix");
        assertThat(resolver.matchType("AMZN", TestData.amazon())).isEqualTo(MerchantMatchType.ALIAS);
    }

    @Test
    @DisplayName("Canonical-name matches rank above alias-only matches")
    void canonicalBeforeAlias() {
        // Given: a merchant whose canonical name is another merchant's alias
        Merchant amznLogistics = Merchant.builder().id("m_amzn").canonicalName("AMZN").build();

        // When
        List<Merchant> resolved = resolver.resolve("amzn", List.of(TestData.amazon(), amznLogistics));

        // Then
        assertThat(resolved).extracting(Merchant::getId).containsExactly("m_amzn", "m_amazon");
    }

    @Test
    @DisplayName("Unknown name resolves to an empty list")
    void noMatch() {
        assertThat(resolver.resolve("Starbucks", catalog)).isEmpty();
        assertThat(resolver.resolve("", catalog)).isEmpty();
    }

    @Test
    @DisplayName("Resolve is exact only; search adds substring matches after exact ones")
    void searchIncludesPartial() {
        assertThat(resolver.resolve("amaz", catalog)).isEmpty();
        assertThat(resolver.search("amaz", catalog)).extracting(Merchant::getId).containsExactly("m_amazon");
    }

    @Test
    @DisplayName("Text shorter than three characters never matches partially")
    void shortTextNoPartial() {
        assertThat(resolver.search("am", catalog)).isEmpty();
        assertThat(resolver.matchType("am", TestData.amazon())).isEqualTo(MerchantMatchType.NONE);
    }
}
