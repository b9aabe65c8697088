package com.comparo.dispatch.api;

import com.comparo.core.model.PromptModification;
import com.comparo.core.model.TargetDescriptor;
import com.comparo.core.request.InvalidRequestException;
import com.comparo.core.selection.PromptModificationStore;
import com.comparo.core.selection.TargetCatalog;
import com.comparo.core.selection.TargetSelectionService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the target catalog, the current selection and per-target prompt modifications.
 */
@RestController
@RequestMapping("/api/v1/targets")
public class TargetController {

    private final TargetCatalog catalog;
    private final TargetSelectionService selectionService;
    private final PromptModificationStore modificationStore;

    public TargetController(TargetCatalog catalog,
                            TargetSelectionService selectionService,
                            PromptModificationStore modificationStore) {
        this.catalog = catalog;
        this.selectionService = selectionService;
        this.modificationStore = modificationStore;
    }

    @GetMapping
    public ResponseEntity<List<TargetDescriptor>> listTargets() {
        return ResponseEntity.ok(catalog.all());
    }

    @GetMapping("/selection")
    public ResponseEntity<List<String>> getSelection() {
        return ResponseEntity.ok(selectionService.selectedTargets());
    }

    @PutMapping("/selection")
    public ResponseEntity<List<String>> setSelection(@RequestBody List<String> targetIds) {
        selectionService.setSelectedTargets(targetIds);
        return ResponseEntity.ok(selectionService.selectedTargets());
    }

    @PostMapping("/selection/{targetId}/toggle")
    public ResponseEntity<List<String>> toggle(@PathVariable String targetId) {
        selectionService.toggleTarget(targetId);
        return ResponseEntity.ok(selectionService.selectedTargets());
    }

    @PostMapping("/selection/reset")
    public ResponseEntity<List<String>> reset() {
        selectionService.resetToDefaults();
        return ResponseEntity.ok(selectionService.selectedTargets());
    }

    @GetMapping("/prompts")
    public ResponseEntity<List<PromptModificationStore.Summary>> promptSummary() {
        return ResponseEntity.ok(modificationStore.summary());
    }

    @GetMapping("/{targetId}/prompt")
    public ResponseEntity<PromptModification> getPrompt(@PathVariable String targetId) {
        return modificationStore.getModification(targetId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/{targetId}/prompt")
    public ResponseEntity<PromptModification> setPrompt(@PathVariable String targetId,
                                                        @RequestBody PromptModification modification) {
        if (!catalog.contains(targetId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(modificationStore.setModification(targetId, modification));
    }

    @DeleteMapping("/{targetId}/prompt")
    public ResponseEntity<Void> deletePrompt(@PathVariable String targetId) {
        return modificationStore.removeModification(targetId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping(value = "/prompts/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportPrompts() {
        return ResponseEntity.ok(modificationStore.exportAsJson());
    }

    @PostMapping(value = "/prompts/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Integer>> importPrompts(@RequestBody String json) {
        return ResponseEntity.ok(Map.of("imported", modificationStore.importFromJson(json)));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(InvalidRequestException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
