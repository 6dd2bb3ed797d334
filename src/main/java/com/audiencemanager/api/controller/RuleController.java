package com.audiencemanager.api.controller;

import com.audiencemanager.api.dto.request.RuleRequest;
import com.audiencemanager.api.dto.request.RuleUpdateRequest;
import com.audiencemanager.api.dto.response.MaterializationRunResponse;
import com.audiencemanager.api.dto.response.RuleResponse;
import com.audiencemanager.api.dto.response.TriggerResponse;
import com.audiencemanager.catalog.SegmentCatalogService;
import com.audiencemanager.condition.ConditionInputAdapter;
import com.audiencemanager.domain.model.RuleDefinition;
import com.audiencemanager.domain.model.RuleUpdate;
import com.audiencemanager.mapper.RuleDtoMapper;
import com.audiencemanager.materialization.MaterializationScheduler;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for segmentation rules.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/rules} -- create a rule and its segment</li>
 *   <li>{@code GET /api/rules} -- list all rules</li>
 *   <li>{@code GET /api/rules/{id}} -- get a rule</li>
 *   <li>{@code PUT /api/rules/{id}} -- partially update a rule</li>
 *   <li>{@code DELETE /api/rules/{id}} -- delete a rule, its segment and output table</li>
 *   <li>{@code POST /api/rules/{id}/trigger} -- queue an immediate materialization</li>
 *   <li>{@code GET /api/rules/{id}/runs} -- run history, newest first</li>
 *   <li>{@code POST /api/rules/refresh-all} -- materialize every active rule in dependency order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/rules")
public class RuleController {

    private final SegmentCatalogService segmentCatalogService;
    private final MaterializationScheduler materializationScheduler;
    private final ConditionInputAdapter conditionInputAdapter;

    private final RuleDtoMapper ruleDtoMapper = Mappers.getMapper(RuleDtoMapper.class);

    public RuleController(
            SegmentCatalogService segmentCatalogService,
            MaterializationScheduler materializationScheduler,
            ConditionInputAdapter conditionInputAdapter) {
        this.segmentCatalogService = segmentCatalogService;
        this.materializationScheduler = materializationScheduler;
        this.conditionInputAdapter = conditionInputAdapter;
    }

    // ========================
    // RULES
    // ========================

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RuleResponse createRule(@RequestBody @Valid RuleRequest request) {
        RuleDefinition definition = ruleDtoMapper.toDefinition(request);
        definition.setConditions(conditionInputAdapter.normalize(request.getConditions()));
        return ruleDtoMapper.toResponse(segmentCatalogService.createRule(definition));
    }

    @GetMapping
    public List<RuleResponse> getAllRules() {
        return ruleDtoMapper.toResponseList(segmentCatalogService.listRules());
    }

    @GetMapping("/{id}")
    public RuleResponse getRule(@PathVariable Long id) {
        return ruleDtoMapper.toResponse(segmentCatalogService.getRule(id));
    }

    @PutMapping("/{id}")
    public RuleResponse updateRule(@PathVariable Long id, @RequestBody @Valid RuleUpdateRequest request) {
        RuleUpdate update = ruleDtoMapper.toUpdate(request);
        if (request.getConditions() != null) {
            update.setConditions(conditionInputAdapter.normalize(request.getConditions()));
        }
        return ruleDtoMapper.toResponse(segmentCatalogService.updateRule(id, update));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteRule(@PathVariable Long id) {
        segmentCatalogService.deleteRule(id);
    }

    // ========================
    // MATERIALIZATION
    // ========================

    @PostMapping("/{id}/trigger")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public TriggerResponse triggerRule(@PathVariable Long id) {
        segmentCatalogService.triggerRule(id);
        return TriggerResponse.builder()
                .ruleId(id)
                .message("Materialization queued")
                .build();
    }

    @GetMapping("/{id}/runs")
    public List<MaterializationRunResponse> getRuns(@PathVariable Long id) {
        return ruleDtoMapper.toRunResponseList(segmentCatalogService.getRuns(id));
    }

    @PostMapping("/refresh-all")
    public List<MaterializationRunResponse> refreshAll() {
        return ruleDtoMapper.toRunResponseList(materializationScheduler.refreshAll());
    }
}
