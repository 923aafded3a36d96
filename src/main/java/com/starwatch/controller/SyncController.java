package com.starwatch.controller;

import com.starwatch.model.SyncOptions;
import com.starwatch.model.SyncReport;
import com.starwatch.service.SyncPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SyncController {

    private final SyncPipeline syncPipeline;

    @PostMapping("/sync")
    public ResponseEntity<SyncReport> sync(
        @RequestParam(name = "skip_enrich", defaultValue = "false") boolean skipEnrichment,
        @RequestParam(name = "force", defaultValue = "false") boolean forceReEnrich,
        @RequestParam(name = "refresh", defaultValue = "false") boolean forceRefetch) {

        return ResponseEntity.ok(syncPipeline.run(new SyncOptions(skipEnrichment, forceReEnrich, forceRefetch)));
    }

    @PostMapping("/schema")
    public ResponseEntity<Void> initSchema() {
        syncPipeline.initSchema();
        return ResponseEntity.noContent().build();
    }
}
