package de.levingamer8.greaterlauncher.mods;

import de.levingamer8.greaterlauncher.core.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

/**
 * Builds a {@link ModCatalog} from the game's {@code mod} folder.
 * <p>
 * Two layouts are recognized: the classic {@code mod/<Name>.mod} descriptor next to its
 * {@code mod/<Folder>/} content folder, and a folder carrying its own {@code descriptor.mod}.
 * A folder that is neither referenced by a descriptor nor carries one is reported as a warning.
 */
public class ModScanner {

    private static final Logger LOG = LoggerFactory.getLogger(ModScanner.class);

    public static final String DESCRIPTOR_EXT = ".mod";
    public static final String FOLDER_DESCRIPTOR = "descriptor.mod";

    private final Set<String> hiddenIds;

    public ModScanner() {
        this(Set.of("z_launcher"));
    }

    public ModScanner(Set<String> hiddenIds) {
        this.hiddenIds = Set.copyOf(hiddenIds);
    }

    public ScanResult scan(Path modsRoot) throws IOException {
        if (!Files.isDirectory(modsRoot)) {
            throw new NoSuchFileException(modsRoot.toString(), null, "mod folder does not exist");
        }
        Path root = modsRoot.toAbsolutePath().normalize();

        List<Path> children;
        try (var s = Files.list(root)) {
            children = s.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
        }

        Map<String, Mod> mods = new LinkedHashMap<>();
        Set<Path> claimedFolders = new HashSet<>();
        List<ScanResult.Warning> warnings = new ArrayList<>();

        for (Path file : children) {
            String fileName = file.getFileName().toString();
            if (!Files.isRegularFile(file) || !fileName.toLowerCase(Locale.ROOT).endsWith(DESCRIPTOR_EXT)) continue;

            String id = fileName.substring(0, fileName.length() - DESCRIPTOR_EXT.length());
            ModDescriptor d;
            try {
                d = ModDescriptor.parse(FileUtil.readText(file));
            } catch (IOException e) {
                warn(warnings, file, "unreadable descriptor: " + e.getMessage());
                claimedFolders.add(root.resolve(id));
                continue;
            }

            Path folder = root.resolve(d.folderName() != null ? d.folderName() : id).normalize();
            claimedFolders.add(folder);
            if (hiddenIds.contains(id)) continue;

            if (d.name() == null) {
                warn(warnings, file, "descriptor has no name");
                continue;
            }
            if (!Files.isDirectory(folder)) {
                warn(warnings, file, "mod folder not found: " + root.relativize(folder));
                continue;
            }
            mods.put(id, new Mod(id, d.name(), file, "mod/" + fileName, folder,
                    d.userDir(), d.dependencies(), d.github(), d.version()));
        }

        for (Path dir : children) {
            if (!Files.isDirectory(dir) || claimedFolders.contains(dir.normalize())) continue;
            String id = dir.getFileName().toString();
            if (id.startsWith(".") || hiddenIds.contains(id)) continue;

            Path descriptor = dir.resolve(FOLDER_DESCRIPTOR);
            if (!Files.isRegularFile(descriptor)) {
                warn(warnings, dir, "no descriptor file");
                continue;
            }
            if (mods.containsKey(id)) {
                warn(warnings, descriptor, "duplicate mod id '" + id + "', already defined by " + mods.get(id).descriptorRef());
                continue;
            }
            ModDescriptor d;
            try {
                d = ModDescriptor.parse(FileUtil.readText(descriptor));
            } catch (IOException e) {
                warn(warnings, descriptor, "unreadable descriptor: " + e.getMessage());
                continue;
            }
            if (d.name() == null) {
                warn(warnings, descriptor, "descriptor has no name");
                continue;
            }
            mods.put(id, new Mod(id, d.name(), descriptor, "mod/" + id + "/" + FOLDER_DESCRIPTOR, dir,
                    d.userDir(), d.dependencies(), d.github(), d.version()));
        }

        ModCatalog catalog = ModCatalog.of(mods.values());
        LOG.info("Scanned {}: {} mods, {} warnings", root, catalog.size(), warnings.size());
        return new ScanResult(catalog, warnings);
    }

    private static void warn(List<ScanResult.Warning> warnings, Path file, String reason) {
        LOG.warn("Skipping {}: {}", file, reason);
        warnings.add(new ScanResult.Warning(file, reason));
    }
}
