package com.comparo.core.selection;

import com.comparo.core.model.PromptModification;
import com.comparo.core.model.PromptModifier;
import com.comparo.core.request.InvalidRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of per-target prompt customizations, turned into prompt modifiers at dispatch.
 */
@Service
public class PromptModificationStore {

    private static final Logger log = LoggerFactory.getLogger(PromptModificationStore.class);

    private final ConcurrentHashMap<String, PromptModification> modifications = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PromptModificationStore(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    PromptModificationStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Optional<PromptModification> getModification(String targetId) {
        return Optional.ofNullable(modifications.get(targetId));
    }

    public Map<String, PromptModification> getAllModifications() {
        return Map.copyOf(modifications);
    }

    /** Stores a modification, stamping it with the current time. */
    public PromptModification setModification(String targetId, PromptModification modification) {
        PromptModification stamped = modification.withLastModified(clock.instant());
        modifications.put(targetId, stamped);
        log.info("Stored prompt modification for {} (replace={})", targetId, stamped.replaceSystemMessage());
        return stamped;
    }

    public boolean removeModification(String targetId) {
        return modifications.remove(targetId) != null;
    }

    public void clearAll() {
        modifications.clear();
    }

    public boolean hasModification(String targetId) {
        PromptModification modification = modifications.get(targetId);
        return modification != null && modification.hasCustomMessage();
    }

    /**
     * Prompt modifiers for the given targets. Targets without a stored customization are absent,
     * which leaves their default prompt unchanged.
     */
    public Map<String, PromptModifier> modifiersFor(Collection<String> targetIds) {
        Map<String, PromptModifier> result = new HashMap<>();
        for (String targetId : targetIds) {
            if (hasModification(targetId)) {
                result.put(targetId, modifications.get(targetId).toModifier());
            }
        }
        return result;
    }

    public String exportAsJson() {
        try {
            return objectMapper.copy()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(new LinkedHashMap<>(modifications));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export prompt modifications", e);
        }
    }

    /**
     * Adds or replaces the modifications contained in a JSON object keyed by target id.
     * Nothing is imported unless every entry is valid.
     *
     * @return number of modifications imported
     * @throws InvalidRequestException if the JSON cannot be read or an entry is empty
     */
    public int importFromJson(String json) {
        Map<String, PromptModification> imported;
        try {
            imported = objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, PromptModification>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Rejected prompt modification import: {}", e.getOriginalMessage());
            throw new InvalidRequestException("Invalid JSON format for prompt modifications");
        }
        if (imported == null) {
            return 0;
        }
        for (Map.Entry<String, PromptModification> entry : imported.entrySet()) {
            if (entry.getKey().isBlank() || entry.getValue() == null) {
                log.warn("Rejected prompt modification import: empty entry for target '{}'", entry.getKey());
                throw new InvalidRequestException("Prompt modification for target '" + entry.getKey() + "' is empty");
            }
        }
        Instant now = clock.instant();
        imported.forEach((targetId, modification) -> modifications.put(targetId,
                modification.lastModified() == null ? modification.withLastModified(now) : modification));
        log.info("Imported {} prompt modification(s)", imported.size());
        return imported.size();
    }

    public List<Summary> summary() {
        return modifications.entrySet().stream()
                .map(e -> new Summary(e.getKey(), e.getValue().hasCustomMessage(),
                        e.getValue().replaceSystemMessage(), e.getValue().lastModified()))
                .sorted((a, b) -> a.targetId().compareTo(b.targetId()))
                .toList();
    }

    public record Summary(String targetId, boolean hasCustomMessage, boolean replaces, Instant lastModified) {}
}
