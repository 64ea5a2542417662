package de.levingamer8.greaterlauncher.settings;

import java.util.NoSuchElementException;

public class SettingNotFoundException extends NoSuchElementException {

    private final SettingsKey key;

    public SettingNotFoundException(SettingsKey key) {
        this(key, "Setting not found: " + key.name());
    }

    public SettingNotFoundException(SettingsKey key, String message) {
        super(message);
        this.key = key;
    }

    public SettingsKey key() { return key; }
}
