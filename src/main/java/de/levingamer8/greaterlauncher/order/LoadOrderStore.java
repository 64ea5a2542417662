package de.levingamer8.greaterlauncher.order;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.levingamer8.greaterlauncher.core.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Durable snapshot of a {@link LoadOrderList}: ids, enabled flags and positions, nothing else.
 */
public class LoadOrderStore {

    private static final Logger LOG = LoggerFactory.getLogger(LoadOrderStore.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Snapshot(int version, List<LoadOrderEntry> entries) {
        public Snapshot {
            entries = entries == null ? List.of() : List.copyOf(entries);
        }
    }

    private static final int FORMAT_VERSION = 1;

    private final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public void persist(LoadOrderList list, Path path) throws IOException {
        Snapshot s = new Snapshot(FORMAT_VERSION, list.entries());
        FileUtil.writeAtomically(path, om.writeValueAsBytes(s));
        LOG.debug("Load order ({} entries, {} enabled) saved to {}", list.size(), list.enabledIds().size(), path);
    }

    public LoadOrderList restore(Path path) throws IOException {
        if (!Files.exists(path)) return LoadOrderList.empty();
        Snapshot s;
        try {
            s = om.readValue(path.toFile(), Snapshot.class);
        } catch (IOException e) {
            throw new IOException("Failed to read " + path + ": " + e.getMessage(), e);
        }
        LoadOrderList list = LoadOrderList.of(s.entries());
        if (list.size() != s.entries().size()) {
            LOG.warn("{}: dropped {} duplicate entries", path, s.entries().size() - list.size());
        }
        return list;
    }
}
