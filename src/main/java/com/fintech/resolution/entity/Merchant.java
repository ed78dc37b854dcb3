package com.fintech.resolution.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Singular;
import lombok.ToString;

import java.util.Set;

/**
 * A merchant as known to the card network, with the alternate names that show
 * up on statements (e.g. "AMZN Mktp" for Amazon).
 */
@Entity
@Table(name = "merchants")
@Getter
@Builder
@ToString
@EqualsAndHashCode(of = "id")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Merchant {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "canonical_name", nullable = false, length = 120)
    private String canonicalName;

    @Singular
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "merchant_aliases", joinColumns = @JoinColumn(name = "merchant_id"))
    @Column(name = "alias", nullable = false, length = 120)
    private Set<String> aliases;

    @Column(length = 50)
    private String category;

    @Column(length = 500)
    private String description;

    @Column(length = 255)
    private String address;

    @Column(length = 40)
    private String phone;

    @Column(length = 255)
    private String website;

    @Column(name = "parent_company", length = 120)
    private String parentCompany;
}
