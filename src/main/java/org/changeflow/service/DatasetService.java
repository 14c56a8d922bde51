package org.changeflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.changeflow.adapters.RowStore;
import org.changeflow.adapters.TableNamespace;
import org.changeflow.adapters.TableRef;
import org.changeflow.configuration.ChangeflowProperties;
import org.changeflow.exceptions.ForbiddenException;
import org.changeflow.exceptions.ValidationFailedException;
import org.changeflow.models.dto.CreateDatasetRequest;
import org.changeflow.models.dto.DatasetDTO;
import org.changeflow.models.dto.DatasetMetaDTO;
import org.changeflow.models.dto.DatasetVersionDTO;
import org.changeflow.models.dto.RowsPreviewDTO;
import org.changeflow.models.dto.UpdateDatasetRulesRequest;
import org.changeflow.models.entity.Dataset;
import org.changeflow.models.entity.DatasetMeta;
import org.changeflow.models.entity.DatasetVersion;
import org.changeflow.models.entity.Project;
import org.changeflow.models.enums.GateAction;
import org.changeflow.repository.DatasetMetaRepository;
import org.changeflow.repository.DatasetRepository;
import org.changeflow.repository.DatasetVersionRepository;
import org.changeflow.service.access.ProjectAccessService;
import org.changeflow.service.validation.RuleEvaluator;
import org.changeflow.service.validation.SeverityAggregator;
import org.changeflow.service.validation.ValidationReport;
import org.changeflow.utils.AppUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetService {

    private final DatasetRepository datasetRepository;
    private final DatasetMetaRepository datasetMetaRepository;
    private final DatasetVersionRepository datasetVersionRepository;
    private final ProjectService projectService;
    private final ProjectAccessService projectAccessService;
    private final DatasetMetaService datasetMetaService;
    private final RuleEvaluator ruleEvaluator;
    private final SeverityAggregator severityAggregator;
    private final RowStore rowStore;
    private final TableNamespace tableNamespace;
    private final ChangeflowProperties properties;

    @Transactional
    public DatasetDTO create(CreateDatasetRequest request, String actorEmail) {
        Project project = projectService.getRequired(request.projectId());
        if (!projectAccessService.roleOf(actorEmail, project.getId())
                .map(role -> role.satisfies(GateAction.MANAGE_DATASET.getMinimumRole()))
                .orElse(false)) {
            throw new ForbiddenException("Only project owners can create datasets");
        }
        String name = request.name().trim();
        datasetRepository.findByNameIgnoreCaseAndProject_Id(name, project.getId()).ifPresent(existing -> {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Dataset with this name already exists");
        });
        Instant now = Instant.now();
        Dataset dataset = new Dataset();
        dataset.setDatasetUid(AppUtils.generateUUID());
        dataset.setProject(project);
        dataset.setName(name);
        dataset.setDescription(request.description());
        dataset.setSchemaDefinition(request.schema());
        dataset.setRules(request.rules());
        dataset.setCreatedAt(now);
        dataset.setUpdatedAt(now);
        datasetRepository.saveAndFlush(dataset);
        dataset.setTableLocation(tableNamespace.canonical(dataset.getId()).qualified());
        datasetMetaService.recompute(dataset);
        log.info("Created dataset {} '{}' in project {}", dataset.getId(), name, project.getId());
        return toDto(dataset);
    }

    @Transactional(readOnly = true)
    public DatasetDTO get(Long datasetId, String actorEmail) {
        return toDto(readable(datasetId, actorEmail));
    }

    @Transactional(readOnly = true)
    public List<DatasetDTO> listForProject(Long projectId, String actorEmail) {
        Project project = projectService.getRequired(projectId);
        if (!projectAccessService.isMember(actorEmail, project.getId())) {
            throw new ForbiddenException("Not a member of project " + projectId);
        }
        return datasetRepository.findAllByProject_IdOrderByIdAsc(projectId).stream().map(this::toDto).toList();
    }

    /**
     * Replaces the schema and rule set. Pending change requests are checked against the new definitions
     * when they are merged.
     */
    @Transactional
    public DatasetDTO updateRules(Long datasetId, UpdateDatasetRulesRequest request, String actorEmail) {
        Dataset dataset = required(datasetId);
        projectAccessService.require(actorEmail, dataset, GateAction.MANAGE_DATASET);
        dataset.setSchemaDefinition(request.schema());
        dataset.setRules(request.rules());
        dataset.setUpdatedAt(Instant.now());
        datasetRepository.save(dataset);
        log.info("Dataset {} rules updated by {}", datasetId, actorEmail);
        return toDto(dataset);
    }

    @Transactional(readOnly = true)
    public DatasetMetaDTO meta(Long datasetId, String actorEmail) {
        Dataset dataset = readable(datasetId, actorEmail);
        DatasetMeta meta = datasetMetaRepository.findByDataset_Id(datasetId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Dataset meta not found"));
        return new DatasetMetaDTO(
                dataset.getId(),
                meta.getOwnerName(),
                meta.getRowCount(),
                meta.getColumnCount(),
                meta.getPendingApprovals(),
                meta.getTableLocation(),
                meta.getLastUpdateAt()
        );
    }

    @Transactional(readOnly = true)
    public RowsPreviewDTO preview(Long datasetId, int limit, String actorEmail) {
        Dataset dataset = readable(datasetId, actorEmail);
        TableRef canonical = tableNamespace.canonical(dataset.getId());
        int capped = Math.max(1, Math.min(limit, properties.getPreview().getMaxRows()));
        List<Map<String, Object>> rows = rowStore.sampleRows(canonical, capped);
        return new RowsPreviewDTO(dataset.getId(), columns(dataset, rows), rows, rowStore.countRows(canonical));
    }

    /**
     * Checks rows against the dataset's current schema and rules without staging anything.
     */
    @Transactional(readOnly = true)
    public ValidationReport validateRows(Long datasetId, List<Map<String, Object>> rows, String actorEmail) {
        Dataset dataset = required(datasetId);
        projectAccessService.require(actorEmail, dataset, GateAction.PROPOSE);
        ValidationReport report = severityAggregator.aggregate(
                ruleEvaluator.evaluate(dataset.getSchemaDefinition(), dataset.getRules(), rows));
        log.debug("Dry-run validation of {} rows on dataset {}: {}", rows.size(), datasetId, report.state());
        return report;
    }

    /**
     * Replaces every canonical row of the dataset without going through review. Owners only.
     */
    @Transactional
    public DatasetMetaDTO overwrite(Long datasetId, List<Map<String, Object>> rows, String actorEmail) {
        Dataset unlocked = required(datasetId);
        projectAccessService.require(actorEmail, unlocked, GateAction.MANAGE_DATASET);
        ValidationReport report = severityAggregator.aggregate(
                ruleEvaluator.evaluate(unlocked.getSchemaDefinition(), unlocked.getRules(), rows));
        if (report.isFailed()) {
            throw new ValidationFailedException("Rows failed validation", report);
        }
        TableRef canonical = tableNamespace.canonical(datasetId);
        rowStore.createTableIfMissing(canonical);
        Dataset dataset = datasetRepository.findByIdForUpdate(datasetId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Dataset not found"));
        long removed = rowStore.clearRows(canonical);
        int written = rowStore.appendRows(canonical, rows);

        Instant now = Instant.now();
        dataset.setTableLocation(canonical.qualified());
        dataset.setUpdatedAt(now);
        DatasetMeta meta = datasetMetaService.recompute(dataset);

        DatasetVersion version = new DatasetVersion();
        version.setDataset(dataset);
        version.setTableLocation(canonical.qualified());
        version.setRowCount(meta.getRowCount());
        version.setRowsAppended((long) written);
        version.setApprovers(List.of());
        version.setAppliedBy(actorEmail);
        version.setAppliedAt(now);
        datasetVersionRepository.save(version);
        log.info("Dataset {} overwritten by {}: {} rows replaced by {}", datasetId, actorEmail, removed, written);
        return new DatasetMetaDTO(dataset.getId(), meta.getOwnerName(), meta.getRowCount(), meta.getColumnCount(),
                meta.getPendingApprovals(), meta.getTableLocation(), meta.getLastUpdateAt());
    }

    @Transactional(readOnly = true)
    public List<DatasetVersionDTO> versions(Long datasetId, String actorEmail) {
        readable(datasetId, actorEmail);
        return datasetVersionRepository.findAllByDataset_IdOrderByIdDesc(datasetId).stream()
                .map(version -> new DatasetVersionDTO(
                        version.getId(),
                        version.getChangeRequest() != null ? version.getChangeRequest().getChangeRequestUid() : null,
                        version.getTableLocation(),
                        version.getRowCount(),
                        version.getRowsAppended(),
                        version.getApprovers() != null ? version.getApprovers() : List.of(),
                        version.getAppliedBy(),
                        version.getAppliedAt()))
                .toList();
    }

    @Transactional(readOnly = true)
    public ResponseEntity<byte[]> exportCsv(Long datasetId, String actorEmail) {
        Dataset dataset = readable(datasetId, actorEmail);
        List<Map<String, Object>> rows = rowStore.readRows(tableNamespace.canonical(dataset.getId()));
        if (rows.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Dataset has no rows to export");
        }
        List<String> headers = columns(dataset, rows);
        StringWriter writer = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(headers.toArray(String[]::new))
                .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Map<String, Object> row : rows) {
                List<Object> values = new ArrayList<>(headers.size());
                for (String header : headers) {
                    values.add(row.get(header));
                }
                printer.printRecord(values);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV export", e);
        }
        log.info("[export-csv] Dataset {} exported {} rows", datasetId, rows.size());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + buildFilename(dataset.getName()))
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(writer.toString().getBytes(StandardCharsets.UTF_8));
    }

    public Dataset required(Long datasetId) {
        return datasetRepository.findById(datasetId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Dataset not found"));
    }

    private Dataset readable(Long datasetId, String actorEmail) {
        Dataset dataset = required(datasetId);
        projectAccessService.require(actorEmail, dataset, GateAction.READ);
        return dataset;
    }

    private List<String> columns(Dataset dataset, List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        Map<String, Object> schema = dataset.getSchemaDefinition();
        if (schema != null && schema.get("properties") instanceof Map<?, ?> properties) {
            properties.keySet().forEach(key -> columns.add(String.valueOf(key)));
        }
        rows.forEach(row -> columns.addAll(row.keySet()));
        return new ArrayList<>(columns);
    }

    private String buildFilename(String name) {
        String base = name == null ? "dataset" : name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return (base.isBlank() ? "dataset" : base) + ".csv";
    }

    private DatasetDTO toDto(Dataset dataset) {
        return new DatasetDTO(
                dataset.getId(),
                dataset.getDatasetUid(),
                dataset.getProject().getId(),
                dataset.getName(),
                dataset.getDescription(),
                dataset.getSchemaDefinition(),
                dataset.getRules(),
                dataset.getTableLocation(),
                dataset.getCreatedAt(),
                dataset.getUpdatedAt()
        );
    }
}
