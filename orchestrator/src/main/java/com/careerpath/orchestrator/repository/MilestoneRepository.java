package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.Milestone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MilestoneRepository extends JpaRepository<Milestone, Long> {

    /** Milestones are written in plan order, so id order is plan order. */
    @Query("SELECT m FROM Milestone m WHERE m.plan.id = :planId ORDER BY m.id")
    List<Milestone> findByPlan(@Param("planId") Long planId);

    /** Resources must already be gone (FK). */
    @Modifying
    @Query("""
            DELETE FROM Milestone m
            WHERE m.plan.id IN (SELECT p.id FROM Plan p WHERE p.transitionId = :transitionId)
            """)
    int deleteByTransition(@Param("transitionId") Long transitionId);
}
