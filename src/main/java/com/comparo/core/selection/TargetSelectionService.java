package com.comparo.core.selection;

import com.comparo.core.config.ComparoProperties;
import com.comparo.core.model.TargetDescriptor;
import com.comparo.core.request.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Keeps the current set of selected targets: between one and {@code maxSelected} distinct
 * catalog entries, in selection order.
 */
@Service
public class TargetSelectionService {

    private static final Logger log = LoggerFactory.getLogger(TargetSelectionService.class);

    private final TargetCatalog catalog;
    private final List<String> defaults;
    private final int maxSelected;
    private List<String> selected;

    @Autowired
    public TargetSelectionService(TargetCatalog catalog, ComparoProperties properties) {
        this(catalog, properties.getTargets().getDefaults(), properties.getTargets().getMaxSelected());
    }

    TargetSelectionService(TargetCatalog catalog, List<String> defaults, int maxSelected) {
        this.catalog = catalog;
        this.maxSelected = maxSelected;
        this.defaults = resolveDefaults(catalog, defaults, maxSelected);
        this.selected = this.defaults;
    }

    public List<TargetDescriptor> availableTargets() {
        return catalog.all();
    }

    public synchronized List<String> selectedTargets() {
        return selected;
    }

    public synchronized List<TargetDescriptor> selectedTargetMetadata() {
        return selected.stream().map(id -> catalog.find(id).orElseThrow()).toList();
    }

    public synchronized boolean isSelected(String targetId) {
        return selected.contains(targetId);
    }

    /**
     * Replaces the selection.
     *
     * @throws InvalidRequestException if an id is unknown or the count is outside 1..maxSelected
     */
    public synchronized void setSelectedTargets(List<String> targetIds) {
        List<String> unknown = targetIds.stream().filter(id -> !catalog.contains(id)).toList();
        if (!unknown.isEmpty()) {
            throw new InvalidRequestException("Invalid target ids: " + String.join(", ", unknown));
        }
        List<String> distinct = List.copyOf(new LinkedHashSet<>(targetIds));
        if (distinct.isEmpty() || distinct.size() > maxSelected) {
            throw new InvalidRequestException("Must select between 1 and " + maxSelected + " targets");
        }
        selected = distinct;
        log.info("Selected targets: {}", selected);
    }

    public synchronized void addTarget(String targetId) {
        if (selected.contains(targetId)) {
            return;
        }
        if (selected.size() >= maxSelected) {
            throw new InvalidRequestException("Cannot select more than " + maxSelected + " targets");
        }
        List<String> next = new ArrayList<>(selected);
        next.add(targetId);
        setSelectedTargets(next);
    }

    public synchronized void removeTarget(String targetId) {
        List<String> next = new ArrayList<>(selected);
        next.remove(targetId);
        if (next.isEmpty()) {
            throw new InvalidRequestException("Must have at least one target selected");
        }
        setSelectedTargets(next);
    }

    public synchronized void toggleTarget(String targetId) {
        if (selected.contains(targetId)) {
            removeTarget(targetId);
        } else {
            addTarget(targetId);
        }
    }

    public synchronized void resetToDefaults() {
        selected = defaults;
    }

    private static List<String> resolveDefaults(TargetCatalog catalog, List<String> configured, int maxSelected) {
        List<String> valid = configured.stream().filter(catalog::contains).distinct().limit(maxSelected).toList();
        if (!valid.isEmpty()) {
            return valid;
        }
        if (!configured.isEmpty()) {
            log.warn("None of the configured default targets {} are in the catalog", configured);
        }
        return catalog.all().stream().map(TargetDescriptor::id).limit(Math.min(2, maxSelected)).toList();
    }
}
