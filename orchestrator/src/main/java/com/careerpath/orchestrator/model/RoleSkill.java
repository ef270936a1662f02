package com.careerpath.orchestrator.model;

import jakarta.persistence.*;

/**
 * Reference data: skills commonly required for a role. Read-only here.
 *
 * DB table: role_skills
 */
@Entity
@Table(name = "role_skills")
public class RoleSkill {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "role_name", nullable = false)
    private String roleName;

    @Column(name = "skill_name", nullable = false)
    private String skillName;

    protected RoleSkill() {}   // required by JPA

    public RoleSkill(String roleName, String skillName) {
        this.roleName  = roleName;
        this.skillName = skillName;
    }

    public Long   getId()        { return id; }
    public String getRoleName()  { return roleName; }
    public String getSkillName() { return skillName; }
}
