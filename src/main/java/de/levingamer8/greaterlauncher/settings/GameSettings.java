package de.levingamer8.greaterlauncher.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.Function;

/**
 * The subset of {@code settings.txt} the launcher lets the user edit.
 * Reading falls back to the game's defaults per key, writing is a chain of conservative patches.
 */
public record GameSettings(
        int width,
        int height,
        boolean fullScreen,
        boolean borderless,
        int masterVolume,
        int musicVolume,
        int soundFxVolume,
        int ambientVolume,
        String playerName,
        AutosaveFrequency autosave,
        boolean debugSaves
) {

    private static final Logger LOG = LoggerFactory.getLogger(GameSettings.class);

    public static final SettingsKey WIDTH = SettingsKey.of("graphics.size.x");
    public static final SettingsKey HEIGHT = SettingsKey.of("graphics.size.y");
    public static final SettingsKey FULL_SCREEN = SettingsKey.of("graphics.fullScreen");
    public static final SettingsKey BORDERLESS = SettingsKey.of("graphics.borderless");
    public static final SettingsKey MASTER_VOLUME = SettingsKey.of("master_volume");
    public static final SettingsKey MUSIC_VOLUME = SettingsKey.of("music_volume");
    public static final SettingsKey SOUND_FX_VOLUME = SettingsKey.of("sound_fx_volume");
    public static final SettingsKey AMBIENT_VOLUME = SettingsKey.of("ambient_volume");
    public static final SettingsKey LAST_PLAYER = SettingsKey.of("lastplayer");
    public static final SettingsKey AUTOSAVE = SettingsKey.of("autosave");
    public static final SettingsKey DEBUG_SAVES = SettingsKey.of("debug_saves");
    public static final SettingsKey UPDATE_TIME = SettingsKey.of("update_time");

    public static final GameSettings DEFAULTS = new GameSettings(
            1920, 1080, false, true, 100, 100, 100, 50, "Player", AutosaveFrequency.YEARLY, false);

    public GameSettings {
        masterVolume = clampVolume(masterVolume);
        musicVolume = clampVolume(musicVolume);
        soundFxVolume = clampVolume(soundFxVolume);
        ambientVolume = clampVolume(ambientVolume);
        if (playerName == null) playerName = "";
        if (autosave == null) autosave = AutosaveFrequency.YEARLY;
    }

    public static GameSettings from(SettingsDocument doc) {
        return new GameSettings(
                read(doc, WIDTH, SettingValue::asInt, DEFAULTS.width),
                read(doc, HEIGHT, SettingValue::asInt, DEFAULTS.height),
                read(doc, FULL_SCREEN, SettingValue::asBoolean, DEFAULTS.fullScreen),
                read(doc, BORDERLESS, SettingValue::asBoolean, DEFAULTS.borderless),
                read(doc, MASTER_VOLUME, v -> (int) v.asDouble(), DEFAULTS.masterVolume),
                read(doc, MUSIC_VOLUME, v -> (int) v.asDouble(), DEFAULTS.musicVolume),
                read(doc, SOUND_FX_VOLUME, v -> (int) v.asDouble(), DEFAULTS.soundFxVolume),
                read(doc, AMBIENT_VOLUME, v -> (int) v.asDouble(), DEFAULTS.ambientVolume),
                read(doc, LAST_PLAYER, SettingValue::asString, DEFAULTS.playerName),
                read(doc, AUTOSAVE, v -> AutosaveFrequency.fromString(v.asString()), DEFAULTS.autosave),
                read(doc, DEBUG_SAVES, SettingValue::asBoolean, DEFAULTS.debugSaves)
        );
    }

    public SettingsDocument applyTo(SettingsDocument doc) {
        return doc
                .patch(WIDTH, Integer.toString(width))
                .patch(HEIGHT, Integer.toString(height))
                .patch(FULL_SCREEN, yesNo(fullScreen))
                .patch(BORDERLESS, yesNo(borderless))
                .patch(SOUND_FX_VOLUME, decimal(soundFxVolume))
                .patch(MUSIC_VOLUME, decimal(musicVolume))
                .patch(MASTER_VOLUME, decimal(masterVolume))
                .patch(AMBIENT_VOLUME, decimal(ambientVolume))
                .patch(LAST_PLAYER, playerName)
                .patch(AUTOSAVE, autosave.name())
                .patch(DEBUG_SAVES, debugSaves ? "1" : "0");
    }

    /** The game reads {@code update_time} as a six-digit decimal. */
    public static SettingsDocument withUpdateTime(SettingsDocument doc, double updateTime) {
        return doc.patch(UPDATE_TIME, decimal(updateTime));
    }

    public String resolution() {
        return width + "x" + height;
    }

    private static <T> T read(SettingsDocument doc, SettingsKey key, Function<SettingValue, T> conv, T fallback) {
        var v = doc.find(key);
        if (v.isEmpty()) return fallback;
        try {
            return conv.apply(v.get());
        } catch (IllegalStateException e) {
            LOG.warn("Settings: {} has unexpected value '{}', using {}", key, v.get().raw(), fallback);
            return fallback;
        }
    }

    private static int clampVolume(int v) {
        return Math.max(0, Math.min(v, 100));
    }

    private static String yesNo(boolean b) {
        return b ? "yes" : "no";
    }

    static String decimal(double d) {
        return String.format(Locale.ROOT, "%.6f", d);
    }
}
