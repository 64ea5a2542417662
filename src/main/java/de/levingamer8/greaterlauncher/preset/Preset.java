package de.levingamer8.greaterlauncher.preset;

import java.util.List;

public record Preset(String name, List<String> modIds) {

    public Preset {
        modIds = modIds == null ? List.of() : List.copyOf(modIds);
    }
}
