package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.Resource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ResourceRepository extends JpaRepository<Resource, Long> {

    @Query("SELECT r FROM Resource r WHERE r.milestone.id = :milestoneId ORDER BY r.id")
    List<Resource> findByMilestone(@Param("milestoneId") Long milestoneId);

    @Modifying
    @Query("""
            DELETE FROM Resource r
            WHERE r.milestone.id IN (
                SELECT m.id FROM Milestone m
                WHERE m.plan.id IN (SELECT p.id FROM Plan p WHERE p.transitionId = :transitionId))
            """)
    int deleteByTransition(@Param("transitionId") Long transitionId);
}
