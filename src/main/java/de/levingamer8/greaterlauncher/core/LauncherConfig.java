package de.levingamer8.greaterlauncher.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Content of {@code launcher_configs.json}. Flags are tri-state: {@code null} means the key is missing
 * or holds something unrecognizable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LauncherConfig(
        @JsonProperty("checked_mods") List<String> checkedMods,
        @JsonProperty("game_root") String gameRoot,
        @JsonProperty("update_time") Double updateTime,
        @JsonProperty("realtime")
        @JsonDeserialize(using = FlagDeserializer.class)
        @JsonSerialize(using = FlagSerializer.class)
        Boolean realtime,
        @JsonProperty("skipintro")
        @JsonDeserialize(using = FlagDeserializer.class)
        @JsonSerialize(using = FlagSerializer.class)
        Boolean skipIntro,
        @JsonProperty("presets") Map<String, List<String>> presets,
        @JsonProperty("merge_event_modifiers")
        @JsonDeserialize(using = FlagDeserializer.class)
        @JsonSerialize(using = FlagSerializer.class)
        Boolean mergeEventModifiers
) {

    public static final double DEFAULT_UPDATE_TIME = 1.0d;

    public LauncherConfig {
        checkedMods = checkedMods == null ? List.of() : List.copyOf(checkedMods);
        Map<String, List<String>> p = new TreeMap<>();
        if (presets != null) presets.forEach((k, v) -> p.put(k, v == null ? List.of() : List.copyOf(v)));
        presets = Collections.unmodifiableMap(p);
    }

    /** What a fresh installation writes (same values as the original launcher). */
    public static LauncherConfig defaults(String gameRoot) {
        return new LauncherConfig(List.of(), gameRoot, DEFAULT_UPDATE_TIME, false, false, Map.of(), true);
    }

    @JsonIgnore
    public double updateTimeOrDefault() {
        return updateTime == null || updateTime <= 0 ? DEFAULT_UPDATE_TIME : updateTime;
    }

    @JsonIgnore
    public boolean mergeEnabled() {
        return !Boolean.FALSE.equals(mergeEventModifiers);
    }

    @JsonIgnore
    public boolean skipIntroEnabled() {
        return Boolean.TRUE.equals(skipIntro);
    }

    public LauncherConfig withCheckedMods(List<String> ids) {
        return new LauncherConfig(ids, gameRoot, updateTime, realtime, skipIntro, presets, mergeEventModifiers);
    }

    public LauncherConfig withGameRoot(String root) {
        return new LauncherConfig(checkedMods, root, updateTime, realtime, skipIntro, presets, mergeEventModifiers);
    }

    public LauncherConfig withPresets(Map<String, List<String>> p) {
        return new LauncherConfig(checkedMods, gameRoot, updateTime, realtime, skipIntro, p, mergeEventModifiers);
    }

    public LauncherConfig withOptions(double updateTime, boolean realtime, boolean skipIntro, boolean merge) {
        return new LauncherConfig(checkedMods, gameRoot, updateTime, realtime, skipIntro, presets, merge);
    }
}
