package org.changeflow.service;

import lombok.RequiredArgsConstructor;
import org.changeflow.configuration.ChangeflowProperties;
import org.changeflow.exceptions.NotPendingException;
import org.changeflow.models.dto.ChangeCommentDTO;
import org.changeflow.models.dto.ChangeRequestDTO;
import org.changeflow.models.dto.ChangeRequestEventDTO;
import org.changeflow.models.dto.ChangeRequestPreviewDTO;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.entity.Dataset;
import org.changeflow.models.enums.ChangeRequestStatus;
import org.changeflow.models.enums.GateAction;
import org.changeflow.models.enums.ProjectRole;
import org.changeflow.repository.ChangeCommentRepository;
import org.changeflow.repository.ChangeRequestEventRepository;
import org.changeflow.repository.ChangeRequestRepository;
import org.changeflow.repository.DatasetRepository;
import org.changeflow.repository.ProjectMemberRepository;
import org.changeflow.service.access.AccessGate;
import org.changeflow.service.access.ProjectAccessService;
import org.changeflow.service.staging.StagingStore;
import org.changeflow.service.validation.ValidationReport;
import org.changeflow.service.validation.ValidationReports;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ChangeRequestQueryService {

    private static final String ALL = "all";

    private final ChangeRequestRepository changeRequestRepository;
    private final ChangeCommentRepository commentRepository;
    private final ChangeRequestEventRepository eventRepository;
    private final DatasetRepository datasetRepository;
    private final ProjectMemberRepository projectMemberRepository;
    private final ProjectAccessService projectAccessService;
    private final ValidationReports validationReports;
    private final ChangeRequestMapper mapper;
    private final StagingStore stagingStore;
    private final ChangeflowProperties properties;

    public ChangeRequestDTO get(String changeRequestUid, String actorEmail) {
        return mapper.toDto(readable(changeRequestUid, actorEmail));
    }

    /**
     * Lists requests visible to the actor. Without a dataset, every project the actor can read is searched.
     * The status filter defaults to pending; {@code all} disables it.
     */
    public List<ChangeRequestDTO> list(Long datasetId, String status, String actorEmail) {
        ChangeRequestStatus filter = parseStatus(status);
        List<ChangeRequest> found;
        if (datasetId != null) {
            Dataset dataset = datasetRepository.findById(datasetId)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Dataset not found"));
            projectAccessService.require(actorEmail, dataset, GateAction.READ);
            found = filter == null
                    ? changeRequestRepository.findAllByDataset_IdOrderByCreatedAtDesc(datasetId)
                    : changeRequestRepository.findAllByDataset_IdAndStatusOrderByCreatedAtDesc(datasetId, filter);
        } else {
            List<Long> projectIds = projectMemberRepository.findAllByUser_EmailIgnoreCase(actorEmail).stream()
                    .filter(member -> AccessGate.allowed(ProjectRole.normalize(member.getRole()).orElse(null), GateAction.READ))
                    .map(member -> member.getProject().getId())
                    .toList();
            if (projectIds.isEmpty()) {
                return List.of();
            }
            found = filter == null
                    ? changeRequestRepository.findAllByDataset_Project_IdInOrderByCreatedAtDesc(projectIds)
                    : changeRequestRepository.findAllByDataset_Project_IdInAndStatusOrderByCreatedAtDesc(projectIds, filter);
        }
        return found.stream().map(mapper::toDto).toList();
    }

    public ValidationReport validationReport(String changeRequestUid, String actorEmail) {
        return validationReports.fromDocument(readable(changeRequestUid, actorEmail).getValidationReport());
    }

    /**
     * First staged rows of a pending request. Staging is gone once the request is closed.
     */
    public ChangeRequestPreviewDTO preview(String changeRequestUid, int limit, String actorEmail) {
        ChangeRequest changeRequest = readable(changeRequestUid, actorEmail);
        if (!changeRequest.isPending()) {
            throw new NotPendingException(changeRequestUid, changeRequest.getStatus());
        }
        int capped = Math.max(1, Math.min(limit, properties.getPreview().getMaxRows()));
        List<Map<String, Object>> rows = stagingStore.sample(changeRequest, capped);
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return new ChangeRequestPreviewDTO(changeRequestUid, changeRequest.getDataset().getId(),
                new ArrayList<>(columns), rows, stagingStore.count(changeRequest));
    }

    public List<ChangeCommentDTO> comments(String changeRequestUid, String actorEmail) {
        ChangeRequest changeRequest = readable(changeRequestUid, actorEmail);
        return commentRepository.findAllByChangeRequest_IdOrderByCreatedAtAscIdAsc(changeRequest.getId()).stream()
                .map(mapper::toDto)
                .toList();
    }

    public List<ChangeRequestEventDTO> events(String changeRequestUid, String actorEmail) {
        ChangeRequest changeRequest = readable(changeRequestUid, actorEmail);
        return eventRepository.findAllByChangeRequest_IdOrderByIdAsc(changeRequest.getId()).stream()
                .map(mapper::toDto)
                .toList();
    }

    private ChangeRequest readable(String changeRequestUid, String actorEmail) {
        ChangeRequest changeRequest = changeRequestRepository.findByChangeRequestUid(changeRequestUid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Change request not found"));
        projectAccessService.requireRead(actorEmail, changeRequest);
        return changeRequest;
    }

    private ChangeRequestStatus parseStatus(String status) {
        if (!StringUtils.hasText(status)) {
            return ChangeRequestStatus.PENDING;
        }
        if (ALL.equalsIgnoreCase(status.trim())) {
            return null;
        }
        return ChangeRequestStatus.fromWire(status)
                .orElseThrow(() -> new IllegalArgumentException("Unknown status filter: " + status));
    }
}
