package org.changeflow.service.lifecycle;

import lombok.RequiredArgsConstructor;
import org.changeflow.models.entity.ApplicationUser;
import org.changeflow.models.entity.ChangeComment;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.entity.ChangeRequestEvent;
import org.changeflow.models.enums.ChangeRequestEventType;
import org.changeflow.repository.ChangeCommentRepository;
import org.changeflow.repository.ChangeRequestEventRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ChangeRequestAudit {

    private final ChangeRequestEventRepository eventRepository;
    private final ChangeCommentRepository commentRepository;

    public ChangeRequestEvent record(ChangeRequest changeRequest,
                                     ChangeRequestEventType type,
                                     String actorEmail,
                                     String message,
                                     Map<String, Object> metadata) {
        ChangeRequestEvent event = new ChangeRequestEvent();
        event.setChangeRequest(changeRequest);
        event.setEventType(type);
        event.setActorEmail(actorEmail);
        event.setMessage(message);
        event.setMetadata(metadata == null || metadata.isEmpty() ? null : metadata);
        event.setCreatedAt(Instant.now());
        return eventRepository.save(event);
    }

    public ChangeComment comment(ChangeRequest changeRequest, ApplicationUser author, String body) {
        ChangeComment comment = new ChangeComment();
        comment.setChangeRequest(changeRequest);
        comment.setAuthor(author);
        comment.setBody(body.trim());
        comment.setCreatedAt(Instant.now());
        return commentRepository.save(comment);
    }
}
