package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.Transition;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD for the transitions table. Spring Data generates the implementation.
 */
public interface TransitionRepository extends JpaRepository<Transition, Long> {
}
