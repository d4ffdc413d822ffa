package com.podshift.dependency.controller;

import com.podshift.dependency.dto.DependencyReport;
import com.podshift.dependency.dto.MigrationPlanRequest;
import com.podshift.dependency.model.ResolutionResult;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.service.DependencyResolver;
import com.podshift.dependency.service.report.DependencyReportAssembler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing dependency resolution and migration planning.
 */
@RestController
@RequestMapping("/api/migration")
@RequiredArgsConstructor
@Slf4j
public class MigrationPlanController {

    private final DependencyResolver dependencyResolver;
    private final DependencyReportAssembler reportAssembler;

    /**
     * Resolve the dependency graph of a snapshot and compute its migration plan.
     * Settings in the request override the configured defaults for this run only.
     */
    @PostMapping("/plan")
    public ResponseEntity<DependencyReport> plan(@Valid @RequestBody MigrationPlanRequest request) {
        log.info("Planning migration for snapshot: {}", request.getSnapshot().getSnapshotId());

        ResolverSettings settings = request.getSettings() == null
                ? dependencyResolver.getDefaultSettings()
                : request.getSettings().applyTo(dependencyResolver.getDefaultSettings());

        ResolutionResult result = dependencyResolver.resolve(request.getSnapshot(), settings);
        return ResponseEntity.ok(reportAssembler.assemble(result));
    }

    /**
     * Get the configured default settings.
     */
    @GetMapping("/settings")
    public ResponseEntity<ResolverSettings> getDefaultSettings() {
        return ResponseEntity.ok(dependencyResolver.getDefaultSettings());
    }
}
