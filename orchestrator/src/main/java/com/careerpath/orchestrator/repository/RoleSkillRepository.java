package com.careerpath.orchestrator.repository;

import com.careerpath.orchestrator.model.RoleSkill;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RoleSkillRepository extends JpaRepository<RoleSkill, Long> {

    List<RoleSkill> findByRoleNameIgnoreCase(String roleName);
}
