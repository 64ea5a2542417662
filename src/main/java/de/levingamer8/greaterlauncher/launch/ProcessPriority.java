package de.levingamer8.greaterlauncher.launch;

public enum ProcessPriority {
    NORMAL, HIGH, REALTIME;

    /**
     * Maps the launcher's {@code realtime} flag: set → {@link #REALTIME}, explicitly off → {@link #HIGH}
     * (the class the launcher always used when realtime was off), missing or unreadable → {@link #NORMAL}.
     */
    public static ProcessPriority fromRealtimeFlag(Boolean realtime) {
        if (realtime == null) return NORMAL;
        return realtime ? REALTIME : HIGH;
    }

    public String startSwitch() {
        return "/" + name().toLowerCase();
    }
}
