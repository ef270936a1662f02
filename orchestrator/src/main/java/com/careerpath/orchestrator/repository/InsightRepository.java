package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.Insight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface InsightRepository extends JpaRepository<Insight, Long> {

    List<Insight> findByTransitionIdOrderByIdAsc(Long transitionId);

    @Modifying
    @Query("DELETE FROM Insight i WHERE i.transitionId = :transitionId")
    int deleteByTransition(@Param("transitionId") Long transitionId);
}
