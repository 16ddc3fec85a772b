package com.shopsense.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "users")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode(of = "id")
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false)
    private String firstName;

    @Column(nullable = false)
    private String lastName;

    @Column(nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    @Embedded
    @Builder.Default
    private PersonalizationScores personalizationScores = new PersonalizationScores();

    @Embedded
    @Builder.Default
    private BehaviorStats behavior = new BehaviorStats();

    /** Hour of day (0-23) to number of clicks */
    @ElementCollection
    @CollectionTable(name = "user_hourly_clicks", joinColumns = @JoinColumn(name = "user_id"))
    @MapKeyColumn(name = "hour_of_day")
    @Column(name = "clicks")
    @Builder.Default
    @ToString.Exclude
    private Map<Integer, Integer> hourlyClicks = new HashMap<>();

    /** Day of week (1 = Monday) to number of clicks */
    @ElementCollection
    @CollectionTable(name = "user_weekday_clicks", joinColumns = @JoinColumn(name = "user_id"))
    @MapKeyColumn(name = "day_of_week")
    @Column(name = "clicks")
    @Builder.Default
    @ToString.Exclude
    private Map<Integer, Integer> weekdayClicks = new HashMap<>();

    @OneToOne(mappedBy = "user", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @ToString.Exclude
    private UserPreference preference;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
