package com.careerpath.orchestrator.model;

import jakarta.persistence.*;

/**
 * A learning resource attached to a milestone.
 *
 * DB table: resources
 */
@Entity
@Table(name = "resources")
public class Resource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "milestone_id", nullable = false)
    private Milestone milestone;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(columnDefinition = "TEXT")
    private String url;

    // course, article, book, video ...
    @Column(columnDefinition = "TEXT")
    private String type;

    protected Resource() {}   // required by JPA

    public Resource(Milestone milestone, String title, String url, String type) {
        this.milestone = milestone;
        this.title     = title;
        this.url       = url;
        this.type      = type;
    }

    public Long      getId()        { return id; }
    public Milestone getMilestone() { return milestone; }
    public String    getTitle()     { return title; }
    public String    getUrl()       { return url; }
    public String    getType()      { return type; }
}
