package com.careerpath.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One observation, challenge or story line produced by the insight stage.
 *
 * DB table: insights
 */
@Entity
@Table(name = "insights")
public class Insight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transition_id", nullable = false)
    private Long transitionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InsightType type;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(columnDefinition = "TEXT")
    private String source;

    @Column(name = "insight_date", columnDefinition = "TEXT")
    private String date;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Insight() {}   // required by JPA

    public Insight(Long transitionId, InsightType type, String content, String source, String date) {
        this.transitionId = transitionId;
        this.type         = type;
        this.content      = content;
        this.source       = source;
        this.date         = date;
    }

    public Long        getId()           { return id; }
    public Long        getTransitionId() { return transitionId; }
    public InsightType getType()         { return type; }
    public String      getContent()      { return content; }
    public String      getSource()       { return source; }
    public String      getDate()         { return date; }
    public Instant     getCreatedAt()    { return createdAt; }
}
