package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.SkillGap;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SkillGapRepository extends JpaRepository<SkillGap, Long> {

    List<SkillGap> findByTransitionIdOrderByIdAsc(Long transitionId);

    @Modifying
    @Query("DELETE FROM SkillGap g WHERE g.transitionId = :transitionId")
    int deleteByTransition(@Param("transitionId") Long transitionId);
}
