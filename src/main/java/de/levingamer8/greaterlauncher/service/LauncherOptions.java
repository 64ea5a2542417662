package de.levingamer8.greaterlauncher.service;

import de.levingamer8.greaterlauncher.core.LauncherConfig;

public record LauncherOptions(double updateTime, boolean realtime, boolean skipIntro, boolean mergeEventModifiers) {

    public LauncherOptions {
        if (!(updateTime > 0)) throw new IllegalArgumentException("updateTime must be > 0: " + updateTime);
    }

    public static LauncherOptions of(LauncherConfig cfg) {
        return new LauncherOptions(cfg.updateTimeOrDefault(), Boolean.TRUE.equals(cfg.realtime()),
                cfg.skipIntroEnabled(), cfg.mergeEnabled());
    }

    public LauncherOptions withUpdateTime(double t) {
        return new LauncherOptions(t, realtime, skipIntro, mergeEventModifiers);
    }
}
