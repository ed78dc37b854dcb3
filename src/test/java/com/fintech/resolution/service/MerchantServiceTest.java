package com.fintech.resolution.service;

import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.exception.InvalidQueryException;
import com.fintech.resolution.exception.NotFoundException;
import com.fintech.resolution.matching.MerchantResolver;
import com.fintech.resolution.repository.MerchantRepository;
import com.fintech.resolution.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MerchantServiceTest {

    @Mock
    private MerchantRepository merchantRepository;

    private MerchantService merchantService;

    @BeforeEach
    void setUp() {
        merchantService = new MerchantService(merchantRepository, new MerchantResolver());
    }

    @Test
    @DisplayName("Should resolve an alias to its merchant")
    void searchByAlias() {
        when(merchantRepository.findAllWithAliases())
                .thenReturn(List.of(TestData.coffeePalace(), TestData.amazon(), TestData.netflix()));

        assertThat(merchantService.search("amzn"))
                .extracting(Merchant::getId)
                .containsExactly("m_amazon");
    }

    @Test
    @DisplayName("Should return nothing for an unknown merchant")
    void unknownMerchant() {
        when(merchantRepository.findAllWithAliases()).thenReturn(List.of(TestData.amazon()));

        assertThat(merchantService.search("Starbucks")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a blank name without reading the catalog")
    void blankName() {
        assertThatThrownBy(() -> merchantService.search(" "))
                .isInstanceOf(InvalidQueryException.class);

        verifyNoInteractions(merchantRepository);
    }

    @Test
    @DisplayName("Should index the catalog by merchant id")
    void catalog() {
        when(merchantRepository.findAllWithAliases()).thenReturn(List.of(TestData.coffeePalace(), TestData.amazon()));

        assertThat(merchantService.catalog()).containsOnlyKeys("m_coffee", "m_amazon");
    }

    @Test
    @DisplayName("Should report a missing merchant")
    void missingMerchant() {
        when(merchantRepository.findById("m_missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> merchantService.getMerchant("m_missing"))
                .isInstanceOf(NotFoundException.class);
    }
}
