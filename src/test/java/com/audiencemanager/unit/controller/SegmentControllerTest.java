package com.audiencemanager.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.audiencemanager.api.controller.SegmentController;
import com.audiencemanager.catalog.SegmentCatalogService;
import com.audiencemanager.config.ApiResponseAdvice;
import com.audiencemanager.domain.enums.RefreshSchedule;
import com.audiencemanager.domain.enums.SetOperation;
import com.audiencemanager.domain.model.LineageEdge;
import com.audiencemanager.domain.model.LineageGraph;
import com.audiencemanager.domain.model.LineageNode;
import com.audiencemanager.domain.model.Segment;
import com.audiencemanager.domain.model.SegmentDataset;
import com.audiencemanager.exception.GlobalExceptionHandler;
import com.audiencemanager.exception.ResourceNotFoundException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the SegmentController.
 */
@ExtendWith(MockitoExtension.class)
class SegmentControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SegmentCatalogService segmentCatalogService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SegmentController(segmentCatalogService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private static Segment baseSegment() {
        return Segment.builder()
                .id(11L)
                .ruleId(1L)
                .segmentName("segment_1")
                .tableName("segment_output_1")
                .compiledQuery("WITH all_transactions AS (...) SELECT ...")
                .refreshFrequency(RefreshSchedule.DAILY)
                .rowCount(3L)
                .build();
    }

    private static Segment compositeSegment() {
        return Segment.builder()
                .id(12L)
                .ruleId(2L)
                .segmentName("segment_2")
                .tableName("segment_output_2")
                .dependsOn(List.of(1L))
                .operation(SetOperation.INTERSECTION)
                .refreshFrequency(RefreshSchedule.DAILY)
                .build();
    }

    @Test
    @DisplayName("GET /api/segments lists base and composite segments")
    void listSegments() throws Exception {
        when(segmentCatalogService.listSegments()).thenReturn(List.of(baseSegment(), compositeSegment()));

        mockMvc.perform(get("/api/segments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].composite").value(false))
                .andExpect(jsonPath("$.data[0].rowCount").value(3))
                .andExpect(jsonPath("$.data[1].composite").value(true))
                .andExpect(jsonPath("$.data[1].dependsOn[0]").value(1))
                .andExpect(jsonPath("$.data[1].operation").value("INTERSECTION"));
    }

    @Test
    @DisplayName("GET /api/segments/by-rule/{ruleId} returns the rule's segment")
    void segmentByRule() throws Exception {
        when(segmentCatalogService.getSegmentByRule(1L)).thenReturn(baseSegment());

        mockMvc.perform(get("/api/segments/by-rule/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(11))
                .andExpect(jsonPath("$.data.tableName").value("segment_output_1"))
                .andExpect(jsonPath("$.data.materialized").value(false));
    }

    @Test
    @DisplayName("GET /api/segments/{id} for an unknown segment returns 404")
    void unknownSegment() throws Exception {
        when(segmentCatalogService.getSegment(99L)).thenThrow(new ResourceNotFoundException("Segment", "99"));

        mockMvc.perform(get("/api/segments/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /api/segments/{id}/lineage resolves the owning rule's lineage")
    void lineage() throws Exception {
        when(segmentCatalogService.getSegment(12L)).thenReturn(compositeSegment());
        when(segmentCatalogService.getLineage(2L)).thenReturn(LineageGraph.builder()
                .rootRuleId(2L)
                .nodes(List.of(
                        LineageNode.builder().ruleId(2L).composite(true).build(),
                        LineageNode.builder().ruleId(1L).build()))
                .edges(List.of(new LineageEdge(1L, 2L)))
                .build());

        mockMvc.perform(get("/api/segments/12/lineage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.rootRuleId").value(2))
                .andExpect(jsonPath("$.data.nodes.length()").value(2))
                .andExpect(jsonPath("$.data.edges[0].parentRuleId").value(1))
                .andExpect(jsonPath("$.data.edges[0].childRuleId").value(2));
    }

    @Test
    @DisplayName("GET /api/segments/{id}/sample-data returns the fixed columns and rows")
    void sampleData() throws Exception {
        when(segmentCatalogService.getSegment(11L)).thenReturn(baseSegment());
        when(segmentCatalogService.sampleRows(11L)).thenReturn(SegmentDataset.ofUsers(5, 6));

        mockMvc.perform(get("/api/segments/11/sample-data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tableName").value("segment_output_1"))
                .andExpect(jsonPath("$.data.columns[0]").value("user_id"))
                .andExpect(jsonPath("$.data.columns.length()").value(4))
                .andExpect(jsonPath("$.data.rowCount").value(2))
                .andExpect(jsonPath("$.data.rows[1].userId").value(6));
    }

    @Test
    @DisplayName("GET /api/segments/{id}/sample-data before materialization is empty")
    void sampleDataEmpty() throws Exception {
        when(segmentCatalogService.getSegment(11L)).thenReturn(baseSegment());
        when(segmentCatalogService.sampleRows(11L)).thenReturn(SegmentDataset.empty());

        mockMvc.perform(get("/api/segments/11/sample-data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.rowCount").value(0))
                .andExpect(jsonPath("$.data.rows.length()").value(0));
    }
}
