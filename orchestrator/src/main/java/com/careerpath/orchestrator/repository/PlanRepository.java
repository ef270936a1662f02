package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.Plan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PlanRepository extends JpaRepository<Plan, Long> {

    Optional<Plan> findFirstByTransitionIdOrderByIdDesc(Long transitionId);

    /** Milestones and resources must already be gone (FK). */
    @Modifying
    @Query("DELETE FROM Plan p WHERE p.transitionId = :transitionId")
    int deleteByTransition(@Param("transitionId") Long transitionId);
}
