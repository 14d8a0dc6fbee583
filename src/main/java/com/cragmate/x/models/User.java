package com.cragmate.x.models;

import com.cragmate.x.dto.enums.RiskTolerance;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "users")
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Column(length = 500)
    private String bio;

    @Column(name = "home_location")
    private String homeLocation;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_tolerance", nullable = false)
    @Builder.Default
    private RiskTolerance riskTolerance = RiskTolerance.BALANCED;

    @Column(name = "profile_visible", nullable = false)
    @Builder.Default
    private boolean profileVisible = true;

    @Column(name = "email_verified", nullable = false)
    @Builder.Default
    private boolean emailVerified = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
