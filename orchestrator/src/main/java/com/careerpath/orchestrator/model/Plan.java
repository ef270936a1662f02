package com.careerpath.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Header row of a development plan; milestones point back to it.
 *
 * DB table: plans
 */
@Entity
@Table(name = "plans")
public class Plan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transition_id", nullable = false)
    private Long transitionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Plan() {}   // required by JPA

    public Plan(Long transitionId) {
        this.transitionId = transitionId;
    }

    public Long    getId()           { return id; }
    public Long    getTransitionId() { return transitionId; }
    public Instant getCreatedAt()    { return createdAt; }
}
