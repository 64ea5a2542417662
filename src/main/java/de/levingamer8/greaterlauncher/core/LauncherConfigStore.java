package de.levingamer8.greaterlauncher.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.util.function.UnaryOperator;

/**
 * Reads and writes {@code launcher_configs.json}. Keys this launcher does not know are kept on save,
 * so other tools (and older launcher versions) can share the file.
 */
public class LauncherConfigStore {

    private static final Logger LOG = LoggerFactory.getLogger(LauncherConfigStore.class);

    private final Path file;
    private final ObjectMapper om;

    public LauncherConfigStore(Path file) {
        this.file = file;
        this.om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path file() { return file; }

    public boolean exists() { return Files.exists(file); }

    public LauncherConfig load() throws IOException {
        if (!Files.exists(file)) return LauncherConfig.defaults(null);
        try {
            return om.treeToValue(readTree(), LauncherConfig.class);
        } catch (IOException e) {
            throw new IOException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    public void save(LauncherConfig config) throws IOException {
        ObjectNode node = Files.exists(file) ? readTree() : om.createObjectNode();
        ObjectNode known = om.valueToTree(config);
        node.setAll(known);
        // null heißt "nicht gesetzt": alten Wert nicht stehen lassen
        for (String flag : new String[]{"realtime", "skipintro", "merge_event_modifiers", "update_time", "game_root"}) {
            if (!known.has(flag)) node.remove(flag);
        }
        FileUtil.writeAtomically(file, om.writeValueAsBytes(node));
        LOG.debug("Launcher config written to {}", file);
    }

    public LauncherConfig ensureExists(String gameRoot) throws IOException {
        if (Files.exists(file)) return load();
        LauncherConfig cfg = LauncherConfig.defaults(gameRoot);
        save(cfg);
        LOG.info("Created {}", file);
        return cfg;
    }

    public LauncherConfig update(UnaryOperator<LauncherConfig> change) throws IOException {
        LauncherConfig updated = change.apply(load());
        save(updated);
        return updated;
    }

    private ObjectNode readTree() throws IOException {
        JsonNode node = om.readTree(file.toFile());
        if (node == null || node.isMissingNode()) return om.createObjectNode();
        if (!(node instanceof ObjectNode obj)) {
            throw new IOException("Failed to read " + file + ": expected a JSON object");
        }
        return obj;
    }
}
