package com.cragmate.x.models;

import com.cragmate.x.dto.enums.Discipline;
import com.cragmate.x.dto.enums.GradeSystem;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Entity
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Table(name = "discipline_profiles",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "discipline"}))
public class DisciplineProfile {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Discipline discipline;

    @Enumerated(EnumType.STRING)
    @Column(name = "grade_system", nullable = false)
    private GradeSystem gradeSystem;

    @Column(name = "comfortable_grade_min_display")
    private String comfortableGradeMinDisplay;

    @Column(name = "comfortable_grade_max_display")
    private String comfortableGradeMaxDisplay;

    @Column(name = "comfortable_grade_min_score", nullable = false)
    private int comfortableGradeMinScore;

    @Column(name = "comfortable_grade_max_score", nullable = false)
    private int comfortableGradeMaxScore;

    @Column(name = "can_lead")
    private boolean canLead;

    @Column(name = "can_belay")
    @Builder.Default
    private boolean canBelay = true;
}
