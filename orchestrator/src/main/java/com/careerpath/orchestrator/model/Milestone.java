package com.careerpath.orchestrator.model;

import jakarta.persistence.*;

/**
 * DB table: milestones
 */
@Entity
@Table(name = "milestones")
public class Milestone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "plan_id", nullable = false)
    private Plan plan;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Priority priority;

    @Column(name = "duration_weeks", nullable = false)
    private int durationWeeks;

    // 1-based, contiguous within a plan
    @Column(name = "sort_order", nullable = false)
    private int order;

    // 0-100, advanced by the user
    @Column(nullable = false)
    private int progress = 0;

    protected Milestone() {}   // required by JPA

    public Milestone(Plan plan, String title, String description, Priority priority, int durationWeeks, int order) {
        this.plan          = plan;
        this.title         = title;
        this.description   = description;
        this.priority      = priority;
        this.durationWeeks = durationWeeks;
        this.order         = order;
    }

    public Long     getId()            { return id; }
    public Plan     getPlan()          { return plan; }
    public String   getTitle()         { return title; }
    public String   getDescription()   { return description; }
    public Priority getPriority()      { return priority; }
    public int      getDurationWeeks() { return durationWeeks; }
    public int      getOrder()         { return order; }
    public int      getProgress()      { return progress; }
}
