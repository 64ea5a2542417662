package de.levingamer8.greaterlauncher.order;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LoadOrderEntry(String modId, boolean enabled, int position) {

    public LoadOrderEntry {
        if (modId == null || modId.isBlank()) throw new IllegalArgumentException("modId must not be blank");
    }

    LoadOrderEntry at(int newPosition) {
        return newPosition == position ? this : new LoadOrderEntry(modId, enabled, newPosition);
    }

    LoadOrderEntry withEnabled(boolean e) {
        return e == enabled ? this : new LoadOrderEntry(modId, e, position);
    }
}
