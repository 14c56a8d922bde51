package org.changeflow.repository;

import org.changeflow.models.entity.ChangeComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChangeCommentRepository extends JpaRepository<ChangeComment, Long> {

    List<ChangeComment> findAllByChangeRequest_IdOrderByCreatedAtAscIdAsc(Long changeRequestId);
}
