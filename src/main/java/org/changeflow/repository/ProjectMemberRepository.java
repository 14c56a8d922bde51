package org.changeflow.repository;

import org.changeflow.models.entity.ProjectMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProjectMemberRepository extends JpaRepository<ProjectMember, Long> {

    Optional<ProjectMember> findByProject_IdAndUser_EmailIgnoreCase(Long projectId, String email);

    List<ProjectMember> findAllByProject_IdOrderByIdAsc(Long projectId);

    List<ProjectMember> findAllByUser_EmailIgnoreCase(String email);
}
