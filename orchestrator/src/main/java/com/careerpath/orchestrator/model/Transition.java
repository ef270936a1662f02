package com.careerpath.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * One career-change analysis request: from currentRole to targetRole.
 *
 * Created by the REST layer; isComplete is flipped only by the orchestrator
 * (and reset by a forced refresh).
 *
 * DB table: transitions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "transitions")
public class Transition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // current_role is reserved in Postgres
    @Column(name = "source_role", nullable = false)
    private String currentRole;

    @Column(name = "target_role", nullable = false)
    private String targetRole;

    // Newline-separated; skills the user already has.
    @Column(name = "existing_skills", columnDefinition = "TEXT")
    private String existingSkills;

    @Column(name = "is_complete", nullable = false)
    private boolean complete = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Transition() {}   // required by JPA

    public Transition(String currentRole, String targetRole, List<String> existingSkills) {
        this.currentRole    = currentRole;
        this.targetRole     = targetRole;
        this.existingSkills = existingSkills == null || existingSkills.isEmpty()
                ? null : String.join("\n", existingSkills);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long    getId()          { return id; }
    public String  getCurrentRole() { return currentRole; }
    public String  getTargetRole()  { return targetRole; }
    public boolean isComplete()     { return complete; }
    public Instant getCreatedAt()   { return createdAt; }
    public Instant getUpdatedAt()   { return updatedAt; }

    public void setComplete(boolean complete) { this.complete = complete; }

    public List<String> getExistingSkills() {
        if (existingSkills == null || existingSkills.isBlank()) {
            return List.of();
        }
        return Arrays.stream(existingSkills.split("\n"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
