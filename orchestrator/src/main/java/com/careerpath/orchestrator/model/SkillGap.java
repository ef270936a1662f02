package com.careerpath.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * DB table: skill_gaps
 */
@Entity
@Table(name = "skill_gaps")
public class SkillGap {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transition_id", nullable = false)
    private Long transitionId;

    @Column(name = "skill_name", nullable = false, columnDefinition = "TEXT")
    private String skillName;

    @Enumerated(EnumType.STRING)
    @Column(name = "gap_level", nullable = false)
    private GapLevel gapLevel;

    // 0-100
    @Column(name = "confidence_score", nullable = false)
    private int confidenceScore;

    @Column(name = "mention_count", nullable = false)
    private int mentionCount = 1;

    @Column(name = "context_summary", columnDefinition = "TEXT")
    private String contextSummary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected SkillGap() {}   // required by JPA

    public SkillGap(Long transitionId, String skillName, GapLevel gapLevel,
                    int confidenceScore, int mentionCount, String contextSummary) {
        this.transitionId    = transitionId;
        this.skillName       = skillName;
        this.gapLevel        = gapLevel;
        this.confidenceScore = confidenceScore;
        this.mentionCount    = mentionCount;
        this.contextSummary  = contextSummary;
    }

    public Long     getId()              { return id; }
    public Long     getTransitionId()    { return transitionId; }
    public String   getSkillName()       { return skillName; }
    public GapLevel getGapLevel()        { return gapLevel; }
    public int      getConfidenceScore() { return confidenceScore; }
    public int      getMentionCount()    { return mentionCount; }
    public String   getContextSummary()  { return contextSummary; }
    public Instant  getCreatedAt()       { return createdAt; }
}
