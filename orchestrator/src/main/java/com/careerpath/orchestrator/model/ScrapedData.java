package com.careerpath.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A stored transition story found by the research stage. Never updated.
 *
 * DB table: scraped_data
 */
@Entity
@Table(name = "scraped_data")
public class ScrapedData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transition_id", nullable = false, updatable = false)
    private Long transitionId;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String source;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String content;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String url;

    // As reported by the source; free-form.
    @Column(name = "post_date", updatable = false, columnDefinition = "TEXT")
    private String postDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ScrapedData() {}   // required by JPA

    public ScrapedData(Long transitionId, String source, String content, String url, String postDate) {
        this.transitionId = transitionId;
        this.source       = source;
        this.content      = content;
        this.url          = url;
        this.postDate     = postDate;
    }

    public Long    getId()           { return id; }
    public Long    getTransitionId() { return transitionId; }
    public String  getSource()       { return source; }
    public String  getContent()      { return content; }
    public String  getUrl()          { return url; }
    public String  getPostDate()     { return postDate; }
    public Instant getCreatedAt()    { return createdAt; }
}
