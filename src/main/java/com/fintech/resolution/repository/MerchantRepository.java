package com.fintech.resolution.repository;

import com.fintech.resolution.entity.Merchant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MerchantRepository extends JpaRepository<Merchant, String> {

    /**
     * Whole catalog with aliases loaded in one round trip.
     */
    @Query("SELECT DISTINCT m FROM Merchant m LEFT JOIN FETCH m.aliases")
    List<Merchant> findAllWithAliases();
}
