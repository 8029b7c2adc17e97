package com.tenantoptions.store;

import com.tenantoptions.model.ModelLabel;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of syncing one model's default options.
 *
 * @param model the synced option model
 * @param actions option name to action, in the order the actions were taken
 */
public record SyncReport(ModelLabel model, Map<String, SyncAction> actions) {

    public SyncReport {
        actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public List<String> namesWith(SyncAction action) {
        return actions.entrySet().stream()
                .filter(e -> e.getValue() == action)
                .map(Map.Entry::getKey)
                .toList();
    }

    /** True if the run wrote anything. */
    public boolean hasChanges() {
        return actions.values().stream().anyMatch(a -> a != SyncAction.VERIFIED);
    }
}
