package de.levingamer8.greaterlauncher.settings;

import de.levingamer8.greaterlauncher.core.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads, patches and writes the game's {@code settings.txt}.
 * Writing always replaces the whole file through a temp file and an atomic rename.
 */
public class SettingsStore {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsStore.class);

    static final String DEFAULT_SETTINGS_RESOURCE = "default-settings.txt";

    public SettingsDocument load(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        try {
            String content = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return SettingsDocument.parse(content);
        } catch (CharacterCodingException e) {
            throw new SettingsParseException(path, "not valid UTF-8", e);
        }
    }

    /** Loads {@code path}, first writing the bundled default settings if the file does not exist yet. */
    public SettingsDocument loadOrCreateDefault(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.info("Settings file {} missing, writing defaults", path);
            write(defaults(), path);
        }
        return load(path);
    }

    public SettingsDocument defaults() throws IOException {
        try (InputStream in = SettingsStore.class.getResourceAsStream(DEFAULT_SETTINGS_RESOURCE)) {
            if (in == null) throw new IOException("Bundled resource missing: " + DEFAULT_SETTINGS_RESOURCE);
            return SettingsDocument.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    public SettingValue get(SettingsDocument doc, SettingsKey key) {
        return doc.get(key);
    }

    public SettingValue get(SettingsDocument doc, String key) {
        return doc.get(SettingsKey.of(key));
    }

    public SettingsDocument patch(SettingsDocument doc, SettingsKey key, String value) {
        return doc.patch(key, value);
    }

    public SettingsDocument patch(SettingsDocument doc, String key, String value) {
        return doc.patch(SettingsKey.of(key), value);
    }

    public void write(SettingsDocument doc, Path path) throws IOException {
        FileUtil.writeAtomically(path, doc.content().getBytes(StandardCharsets.UTF_8));
        LOG.debug("Settings written to {} ({} lines)", path, doc.lineCount());
    }
}
