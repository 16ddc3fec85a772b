package com.shopsense.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "user_preferences")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode(of = "id")
public class UserPreference {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, unique = true)
    @ToString.Exclude
    private User user;

    @Column(precision = 10, scale = 2)
    private BigDecimal minPricePreference;

    @Column(precision = 10, scale = 2)
    private BigDecimal maxPricePreference;

    @ElementCollection
    @CollectionTable(name = "user_preferred_categories", joinColumns = @JoinColumn(name = "preference_id"))
    @Column(name = "category")
    @Builder.Default
    private List<String> preferredCategories = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "user_preferred_brands", joinColumns = @JoinColumn(name = "preference_id"))
    @Column(name = "brand")
    @Builder.Default
    private List<String> preferredBrands = new ArrayList<>();
}
