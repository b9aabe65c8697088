package com.comparo.core.selection;

import com.comparo.core.config.ComparoProperties;
import com.comparo.core.model.TargetDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The targets available for comparison, loaded from {@code comparo.targets.catalog}.
 */
@Component
public class TargetCatalog {

    private static final Logger log = LoggerFactory.getLogger(TargetCatalog.class);

    private final Map<String, TargetDescriptor> targets;

    public TargetCatalog(ComparoProperties properties) {
        this(properties.getTargets().getCatalog().stream()
                .map(t -> new TargetDescriptor(t.getId(), t.getName() == null ? t.getId() : t.getName(),
                        t.getProvider(), t.getTemperature(), t.getMaxTokens(), t.getTopP()))
                .toList());
    }

    public TargetCatalog(List<TargetDescriptor> descriptors) {
        Map<String, TargetDescriptor> byId = new LinkedHashMap<>();
        for (TargetDescriptor descriptor : descriptors) {
            if (descriptor.id() == null || descriptor.id().isBlank()) {
                throw new IllegalArgumentException("Catalog entries require an id");
            }
            if (byId.putIfAbsent(descriptor.id(), descriptor) != null) {
                log.warn("Duplicate catalog entry {} ignored", descriptor.id());
            }
        }
        this.targets = Collections.unmodifiableMap(byId);
        log.info("Target catalog loaded with {} target(s): {}", targets.size(), targets.keySet());
    }

    public List<TargetDescriptor> all() {
        return List.copyOf(targets.values());
    }

    public Optional<TargetDescriptor> find(String targetId) {
        return Optional.ofNullable(targets.get(targetId));
    }

    public boolean contains(String targetId) {
        return targets.containsKey(targetId);
    }
}
