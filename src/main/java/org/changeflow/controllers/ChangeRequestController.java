package org.changeflow.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.models.dto.ChangeCommentDTO;
import org.changeflow.models.dto.ChangeRequestDTO;
import org.changeflow.models.dto.ChangeRequestEventDTO;
import org.changeflow.models.dto.ChangeRequestPreviewDTO;
import org.changeflow.models.dto.CommentRequest;
import org.changeflow.models.dto.DecisionRequest;
import org.changeflow.models.dto.OpenChangeRequestRequest;
import org.changeflow.service.ChangeRequestService;
import org.changeflow.service.validation.ValidationReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/change-requests")
@RequiredArgsConstructor
public class ChangeRequestController {

    private final ChangeRequestService changeRequestService;

    @PostMapping
    public ResponseEntity<ChangeRequestDTO> open(@Valid @RequestBody OpenChangeRequestRequest request,
                                                 Authentication authentication) {
        ChangeRequestDTO created = changeRequestService.open(request, requireUserEmail(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public List<ChangeRequestDTO> list(@RequestParam(required = false) Long datasetId,
                                       @RequestParam(required = false) String status,
                                       Authentication authentication) {
        return changeRequestService.list(datasetId, status, requireUserEmail(authentication));
    }

    @GetMapping("/{changeRequestId}")
    public ChangeRequestDTO get(@PathVariable String changeRequestId, Authentication authentication) {
        return changeRequestService.get(changeRequestId, requireUserEmail(authentication));
    }

    @PostMapping("/{changeRequestId}/decision")
    public ChangeRequestDTO decide(@PathVariable String changeRequestId,
                                   @Valid @RequestBody DecisionRequest request,
                                   Authentication authentication) {
        return changeRequestService.decide(changeRequestId, request, requireUserEmail(authentication));
    }

    @PostMapping("/{changeRequestId}/withdraw")
    public ChangeRequestDTO withdraw(@PathVariable String changeRequestId, Authentication authentication) {
        return changeRequestService.withdraw(changeRequestId, requireUserEmail(authentication));
    }

    @PostMapping("/{changeRequestId}/merge")
    public ChangeRequestDTO retryMerge(@PathVariable String changeRequestId, Authentication authentication) {
        return changeRequestService.retryMerge(changeRequestId, requireUserEmail(authentication));
    }

    @GetMapping("/{changeRequestId}/validation")
    public ValidationReport validation(@PathVariable String changeRequestId, Authentication authentication) {
        return changeRequestService.validationReport(changeRequestId, requireUserEmail(authentication));
    }

    @GetMapping("/{changeRequestId}/preview")
    public ChangeRequestPreviewDTO preview(@PathVariable String changeRequestId,
                                           @RequestParam(defaultValue = "50") int limit,
                                           Authentication authentication) {
        return changeRequestService.preview(changeRequestId, limit, requireUserEmail(authentication));
    }

    @GetMapping("/{changeRequestId}/comments")
    public List<ChangeCommentDTO> comments(@PathVariable String changeRequestId, Authentication authentication) {
        return changeRequestService.comments(changeRequestId, requireUserEmail(authentication));
    }

    @PostMapping("/{changeRequestId}/comments")
    public ResponseEntity<ChangeCommentDTO> addComment(@PathVariable String changeRequestId,
                                                       @Valid @RequestBody CommentRequest request,
                                                       Authentication authentication) {
        ChangeCommentDTO comment = changeRequestService.addComment(changeRequestId, request.body(), requireUserEmail(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(comment);
    }

    @GetMapping("/{changeRequestId}/events")
    public List<ChangeRequestEventDTO> events(@PathVariable String changeRequestId, Authentication authentication) {
        return changeRequestService.events(changeRequestId, requireUserEmail(authentication));
    }

    private String requireUserEmail(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required");
        }
        return authentication.getName();
    }
}
