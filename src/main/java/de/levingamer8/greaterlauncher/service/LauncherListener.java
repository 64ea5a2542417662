package de.levingamer8.greaterlauncher.service;

import de.levingamer8.greaterlauncher.mods.ScanResult;
import de.levingamer8.greaterlauncher.order.LoadOrderList;

import java.util.List;

/** Events the launcher core sends to its UI. All methods are optional. */
public interface LauncherListener {
    default void onCatalogChanged(ScanResult scan) {}
    default void onLoadOrderChanged(LoadOrderList order) {}
    default void onPresetsChanged(List<String> names) {}
    default void onOptionsChanged(LauncherOptions options) {}
    default void onTimeChanged(double updateTime) {}
    default void onLog(String line) {}
}
