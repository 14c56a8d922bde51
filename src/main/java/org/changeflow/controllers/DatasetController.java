package org.changeflow.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.changeflow.models.dto.CreateDatasetRequest;
import org.changeflow.models.dto.DatasetDTO;
import org.changeflow.models.dto.DatasetMetaDTO;
import org.changeflow.models.dto.DatasetVersionDTO;
import org.changeflow.models.dto.OverwriteRowsRequest;
import org.changeflow.models.dto.RowsPreviewDTO;
import org.changeflow.models.dto.UpdateDatasetRulesRequest;
import org.changeflow.models.dto.ValidateRowsRequest;
import org.changeflow.service.DatasetService;
import org.changeflow.service.validation.ValidationReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/datasets")
@RequiredArgsConstructor
public class DatasetController {

    private final DatasetService datasetService;

    @PostMapping
    public ResponseEntity<DatasetDTO> create(@Valid @RequestBody CreateDatasetRequest request,
                                             Authentication authentication) {
        DatasetDTO created = datasetService.create(request, requireUserEmail(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public List<DatasetDTO> list(@RequestParam Long projectId, Authentication authentication) {
        return datasetService.listForProject(projectId, requireUserEmail(authentication));
    }

    @GetMapping("/{datasetId}")
    public DatasetDTO get(@PathVariable Long datasetId, Authentication authentication) {
        return datasetService.get(datasetId, requireUserEmail(authentication));
    }

    @PutMapping("/{datasetId}/rules")
    public DatasetDTO updateRules(@PathVariable Long datasetId,
                                  @RequestBody UpdateDatasetRulesRequest request,
                                  Authentication authentication) {
        return datasetService.updateRules(datasetId, request, requireUserEmail(authentication));
    }

    @GetMapping("/{datasetId}/meta")
    public DatasetMetaDTO meta(@PathVariable Long datasetId, Authentication authentication) {
        return datasetService.meta(datasetId, requireUserEmail(authentication));
    }

    @GetMapping("/{datasetId}/preview")
    public RowsPreviewDTO preview(@PathVariable Long datasetId,
                                  @RequestParam(defaultValue = "50") int limit,
                                  Authentication authentication) {
        return datasetService.preview(datasetId, limit, requireUserEmail(authentication));
    }

    @PostMapping("/{datasetId}/validate")
    public ValidationReport validate(@PathVariable Long datasetId,
                                     @Valid @RequestBody ValidateRowsRequest request,
                                     Authentication authentication) {
        return datasetService.validateRows(datasetId, request.rows(), requireUserEmail(authentication));
    }

    @PutMapping("/{datasetId}/rows")
    public DatasetMetaDTO overwrite(@PathVariable Long datasetId,
                                    @Valid @RequestBody OverwriteRowsRequest request,
                                    Authentication authentication) {
        return datasetService.overwrite(datasetId, request.rows(), requireUserEmail(authentication));
    }

    @GetMapping("/{datasetId}/versions")
    public List<DatasetVersionDTO> versions(@PathVariable Long datasetId, Authentication authentication) {
        return datasetService.versions(datasetId, requireUserEmail(authentication));
    }

    @GetMapping("/{datasetId}/export")
    public ResponseEntity<byte[]> export(@PathVariable Long datasetId, Authentication authentication) {
        return datasetService.exportCsv(datasetId, requireUserEmail(authentication));
    }

    private String requireUserEmail(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required");
        }
        return authentication.getName();
    }
}
