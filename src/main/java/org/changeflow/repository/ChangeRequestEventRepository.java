package org.changeflow.repository;

import org.changeflow.models.entity.ChangeRequestEvent;
import org.changeflow.models.enums.ChangeRequestEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChangeRequestEventRepository extends JpaRepository<ChangeRequestEvent, Long> {

    List<ChangeRequestEvent> findAllByChangeRequest_IdOrderByIdAsc(Long changeRequestId);

    long countByChangeRequest_IdAndEventType(Long changeRequestId, ChangeRequestEventType eventType);
}
