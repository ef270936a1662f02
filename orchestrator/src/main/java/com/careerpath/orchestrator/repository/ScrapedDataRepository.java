package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.ScrapedData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ScrapedDataRepository extends JpaRepository<ScrapedData, Long> {

    List<ScrapedData> findByTransitionIdOrderByIdAsc(Long transitionId);

    @Modifying
    @Query("DELETE FROM ScrapedData s WHERE s.transitionId = :transitionId")
    int deleteByTransition(@Param("transitionId") Long transitionId);
}
