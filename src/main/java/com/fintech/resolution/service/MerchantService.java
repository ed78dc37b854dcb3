package com.fintech.resolution.service;

import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.exception.InvalidQueryException;
import com.fintech.resolution.exception.NotFoundException;
import com.fintech.resolution.matching.MerchantResolver;
import com.fintech.resolution.repository.MerchantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merchant lookups for the "who is this merchant" question and the catalog
 * handed to the matcher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MerchantService {

    private final MerchantRepository merchantRepository;
    private final MerchantResolver merchantResolver;

    @Transactional(readOnly = true)
    public Merchant getMerchant(String merchantId) {
        return merchantRepository.findById(merchantId)
                .orElseThrow(() -> new NotFoundException("Merchant", merchantId));
    }

    /**
     * Exact canonical-name matches first, then alias matches, then substring matches.
     * An unknown name yields an empty list.
     */
    @Transactional(readOnly = true)
    public List<Merchant> search(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidQueryException("Merchant name is required");
        }
        List<Merchant> matches = merchantResolver.search(name, merchantRepository.findAllWithAliases());
        log.debug("Merchant search returned {} match(es)", matches.size());
        return matches;
    }

    @Transactional(readOnly = true)
    public Map<String, Merchant> catalog() {
        Map<String, Merchant> byId = new LinkedHashMap<>();
        for (Merchant merchant : merchantRepository.findAllWithAliases()) {
            byId.put(merchant.getId(), merchant);
        }
        return byId;
    }
}
