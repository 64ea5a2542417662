package de.levingamer8.greaterlauncher.settings;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class GameSettingsTest {

    private final SettingsStore store = new SettingsStore();

    @Test
    void from_shouldReadBundledDefaults() throws IOException {
        assertEquals(GameSettings.DEFAULTS, GameSettings.from(store.defaults()));
    }

    @Test
    void from_shouldFallBackPerKey() {
        SettingsDocument doc = SettingsDocument.parse("master_volume=abc\nlastplayer=\"Otto\"\n");

        GameSettings s = GameSettings.from(doc);

        assertEquals(GameSettings.DEFAULTS.masterVolume(), s.masterVolume());
        assertEquals("Otto", s.playerName());
        assertEquals(GameSettings.DEFAULTS.width(), s.width());
    }

    @Test
    void applyTo_shouldRoundTrip() throws IOException {
        GameSettings s = new GameSettings(1600, 900, true, false, 80, 20, 60, 0, "Bismarck",
                AutosaveFrequency.MONTHLY, true);

        SettingsDocument doc = s.applyTo(store.defaults());

        assertEquals(s, GameSettings.from(doc));
        assertEquals("1600x900", GameSettings.from(doc).resolution());
        assertEquals("80.000000", doc.get(GameSettings.MASTER_VOLUME).asString());
        assertEquals("\"MONTHLY\"", doc.get(GameSettings.AUTOSAVE).raw());
    }

    @Test
    void applyTo_shouldLeaveUnrelatedLinesAlone() throws IOException {
        SettingsDocument defaults = store.defaults();

        SettingsDocument doc = GameSettings.DEFAULTS.applyTo(defaults);

        assertEquals(defaults.lineCount(), doc.lineCount());
        assertEquals(defaults.get(SettingsKey.of("serveradress")), doc.get(SettingsKey.of("serveradress")));
    }

    @Test
    void volumes_shouldBeClamped() {
        GameSettings s = new GameSettings(800, 600, false, false, 150, -5, 50, 50, "p", null, false);

        assertEquals(100, s.masterVolume());
        assertEquals(0, s.musicVolume());
        assertEquals(AutosaveFrequency.YEARLY, s.autosave());
    }

    @Test
    void withUpdateTime_shouldWriteSixDecimals() throws IOException {
        SettingsDocument doc = GameSettings.withUpdateTime(store.defaults(), 2.5);

        assertTrue(doc.content().contains("\nupdate_time=2.500000\n"));
    }
}
