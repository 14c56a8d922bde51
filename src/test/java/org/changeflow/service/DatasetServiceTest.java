package org.changeflow.service;

import org.changeflow.exceptions.ForbiddenException;
import org.changeflow.exceptions.ValidationFailedException;
import org.changeflow.models.dto.CreateDatasetRequest;
import org.changeflow.models.dto.DatasetDTO;
import org.changeflow.models.dto.DatasetMetaDTO;
import org.changeflow.models.dto.DatasetVersionDTO;
import org.changeflow.models.dto.RowsPreviewDTO;
import org.changeflow.models.dto.UpdateDatasetRulesRequest;
import org.changeflow.models.dto.ChangeRequestDTO;
import org.changeflow.models.enums.ValidationState;
import org.changeflow.service.validation.ValidationReport;
import org.changeflow.service.lifecycle.LifecycleTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DatasetService Tests")
class DatasetServiceTest extends LifecycleTestSupport {

    private static final Map<String, Object> SCHEMA = Map.of(
            "properties", Map.of("id", Map.of("type", "integer"), "name", Map.of("type", "string")),
            "required", List.of("id"));

    @Test
    @DisplayName("Owner overwrite replaces every canonical row and records a version")
    void testOverwrite() {
        Long datasetId = newDataset(SCHEMA, null);
        ChangeRequestDTO opened = open(datasetId, List.of(BOB), rows(4));
        approve(opened.id(), BOB);

        DatasetMetaDTO meta = datasetService.overwrite(datasetId, rows(2), OWNER);

        assertEquals(2, meta.rowCount());
        assertEquals(2, meta.columnCount());
        assertEquals(2, canonicalCount(datasetId));
        List<DatasetVersionDTO> versions = datasetService.versions(datasetId, OWNER);
        assertEquals(2, versions.size());
        assertNull(versions.get(0).changeRequestId());
        assertEquals(OWNER, versions.get(0).appliedBy());
        assertEquals(opened.id(), versions.get(1).changeRequestId());
        assertEquals(List.of(BOB), versions.get(1).approvers());
    }

    @Test
    @DisplayName("Overwrite is owner only and validated")
    void testOverwriteGates() {
        Long datasetId = newDataset(SCHEMA, null);
        assertThrows(ForbiddenException.class, () -> datasetService.overwrite(datasetId, rows(1), REQUESTER));
        assertThrows(ValidationFailedException.class,
                () -> datasetService.overwrite(datasetId, List.of(Map.of("name", "no id")), OWNER));
        assertEquals(0, canonicalCount(datasetId));
    }

    @Test
    @DisplayName("Preview is capped and reports the total row count")
    void testPreview() {
        Long datasetId = newDataset(SCHEMA, null);
        datasetService.overwrite(datasetId, rows(150), OWNER);

        RowsPreviewDTO preview = datasetService.preview(datasetId, 1000, VIEWER);
        assertEquals(100, preview.rows().size());
        assertEquals(150, preview.totalRows());
        assertEquals(List.of("id", "name"), preview.columns().stream().sorted().toList());
        assertEquals(1, preview.rows().get(0).get("id"));

        assertEquals(5, datasetService.preview(datasetId, 5, VIEWER).rows().size());
    }

    @Test
    @DisplayName("CSV export writes a header and one line per row")
    void testExportCsv() {
        Long datasetId = newDataset(null, null);
        datasetService.overwrite(datasetId, List.of(Map.of("city", "Lima, Peru")), OWNER);

        ResponseEntity<byte[]> response = datasetService.exportCsv(datasetId, VIEWER);

        String csv = new String(response.getBody(), StandardCharsets.UTF_8);
        assertEquals("city\r\n\"Lima, Peru\"\r\n", csv);
        assertTrue(response.getHeaders().getContentDisposition().toString().contains(".csv"));
    }

    @Test
    @DisplayName("Exporting an empty dataset is a bad request")
    void testExportEmpty() {
        Long datasetId = newDataset();
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> datasetService.exportCsv(datasetId, VIEWER));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    @DisplayName("Dataset names are unique within a project and creation is owner only")
    void testCreate() {
        Long datasetId = newDataset();
        DatasetDTO existing = datasetService.get(datasetId, VIEWER);

        ResponseStatusException duplicate = assertThrows(ResponseStatusException.class, () -> datasetService.create(
                new CreateDatasetRequest(existing.projectId(), existing.name().toUpperCase(), null, null, null), OWNER));
        assertEquals(HttpStatus.CONFLICT, duplicate.getStatusCode());
        assertThrows(ForbiddenException.class, () -> datasetService.create(
                new CreateDatasetRequest(existing.projectId(), "other", null, null, null), REQUESTER));
        assertEquals(tableNamespace.canonical(datasetId).qualified(), existing.tableLocation());
    }

    @Test
    @DisplayName("Rules update is owner only")
    void testUpdateRules() {
        Long datasetId = newDataset();
        assertThrows(ForbiddenException.class, () -> datasetService.updateRules(datasetId,
                new UpdateDatasetRulesRequest(SCHEMA, List.of()), BOB));
        DatasetDTO updated = datasetService.updateRules(datasetId, new UpdateDatasetRulesRequest(SCHEMA, List.of()), OWNER);
        assertEquals(SCHEMA.keySet(), updated.schema().keySet());
    }

    @Test
    @DisplayName("Pending approvals count follows open requests")
    void testPendingApprovals() {
        Long datasetId = newDataset();
        ChangeRequestDTO first = open(datasetId, List.of(BOB), rows(1));
        open(datasetId, List.of(BOB), rows(1));
        assertEquals(2, datasetService.meta(datasetId, OWNER).pendingApprovals());

        reject(first.id(), BOB);
        assertEquals(1, datasetService.meta(datasetId, OWNER).pendingApprovals());
    }

    @Test
    @DisplayName("Dry-run validation reports without staging or writing rows")
    void testValidateRows() {
        Long datasetId = newDataset(SCHEMA, null);

        ValidationReport passed = datasetService.validateRows(datasetId, rows(2), REQUESTER);
        assertEquals(ValidationState.PASSED, passed.state());

        ValidationReport failed = datasetService.validateRows(datasetId,
                List.of(Map.of("id", 1), Map.of("name", "no id")), REQUESTER);
        assertEquals(ValidationState.FAILED, failed.state());
        assertEquals(1, failed.counts().error());
        assertEquals(1, failed.items().get(0).rowIndex());

        assertThrows(ForbiddenException.class, () -> datasetService.validateRows(datasetId, rows(1), VIEWER));
        assertThrows(ForbiddenException.class, () -> datasetService.validateRows(datasetId, rows(1), BOB));
        assertEquals(0, canonicalCount(datasetId));
        assertEquals(0, stagingTableCount(datasetId));
        assertEquals(0, datasetService.meta(datasetId, OWNER).pendingApprovals());
    }
}
