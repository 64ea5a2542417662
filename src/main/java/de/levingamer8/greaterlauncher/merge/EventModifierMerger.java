package de.levingamer8.greaterlauncher.merge;

import de.levingamer8.greaterlauncher.core.FileUtil;
import de.levingamer8.greaterlauncher.mods.Mod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Merges the {@code common/event_modifiers.txt} fragments of the enabled mods into one file.
 * <p>
 * Blocks are keyed by name. The first mod (in load order) that defines a name fixes where the block
 * appears in the output; a later mod defining the same name replaces its content. Every replacement
 * is logged and reported. The output depends only on the mod order and the fragment contents.
 * <p>
 * Fragments are read and the artifact is written as ISO-8859-1, which maps every byte to one char and
 * back, so block bytes reach the output unchanged whatever encoding a mod saved them in.
 */
public class EventModifierMerger {

    private static final Logger LOG = LoggerFactory.getLogger(EventModifierMerger.class);

    static final Charset FRAGMENT_CHARSET = StandardCharsets.ISO_8859_1;

    static final String HEADER = "# Generated by GreaterLauncher. Rebuilt on every launch, do not edit.\n";

    private static final class Slot {
        FragmentBlock block;
        String modId;

        Slot(FragmentBlock block, String modId) {
            this.block = block;
            this.modId = modId;
        }
    }

    /**
     * @param orderedMods enabled mods in load order; mods without a fragment are skipped
     * @param output      artifact to (re)write
     * @throws MergeConflictException if an enabled mod's fragment exists but cannot be read or parsed
     * @throws IOException            if the artifact cannot be written
     */
    public MergeReport merge(List<Mod> orderedMods, Path output) throws IOException, MergeConflictException {
        long t0 = System.nanoTime();

        Map<String, Slot> merged = new LinkedHashMap<>();
        List<String> contributors = new ArrayList<>();
        List<MergeReport.BlockOverride> overrides = new ArrayList<>();

        for (Mod mod : orderedMods) {
            if (!mod.hasEventModifiers()) continue;

            List<FragmentBlock> blocks = read(mod, mod.eventModifiersFile());
            if (!blocks.isEmpty()) contributors.add(mod.id());

            for (FragmentBlock b : blocks) {
                Slot slot = merged.get(b.id());
                if (slot == null) {
                    merged.put(b.id(), new Slot(b, mod.id()));
                    continue;
                }
                boolean identical = slot.block.content().equals(b.content());
                if (identical) {
                    LOG.debug("event_modifiers: block {} from {} redefined identically by {}", b.id(), slot.modId, mod.id());
                } else {
                    LOG.info("event_modifiers: block {} from {} overridden by {}", b.id(), slot.modId, mod.id());
                }
                overrides.add(new MergeReport.BlockOverride(b.id(), slot.modId, mod.id(), identical));
                slot.block = b;
                slot.modId = mod.id();
            }
        }

        FileUtil.writeAtomically(output, render(merged, contributors).getBytes(FRAGMENT_CHARSET));

        LOG.info("event_modifiers merge: {} blocks from {} mods, {} overrides, {} ms -> {}",
                merged.size(), contributors.size(), overrides.size(), (System.nanoTime() - t0) / 1_000_000, output);
        return new MergeReport(output, merged.size(), contributors, overrides);
    }

    private List<FragmentBlock> read(Mod mod, Path fragment) throws MergeConflictException {
        String content;
        try {
            content = readFragment(fragment);
        } catch (IOException e) {
            throw new MergeConflictException(mod.id(), fragment, 0, "unreadable: " + e.getMessage(), e);
        }
        try {
            return FragmentParser.parse(content, fragment.toString());
        } catch (FragmentSyntaxException e) {
            throw new MergeConflictException(mod.id(), fragment, e.line(), e.reason(), e);
        }
    }

    private static String readFragment(Path fragment) throws IOException {
        byte[] bytes = Files.readAllBytes(fragment);
        int start = hasUtf8Bom(bytes) ? 3 : 0;
        return new String(bytes, start, bytes.length - start, FRAGMENT_CHARSET);
    }

    private static boolean hasUtf8Bom(byte[] b) {
        return b.length >= 3 && (b[0] & 0xFF) == 0xEF && (b[1] & 0xFF) == 0xBB && (b[2] & 0xFF) == 0xBF;
    }

    private static String render(Map<String, Slot> merged, List<String> contributors) {
        StringBuilder sb = new StringBuilder(HEADER);
        sb.append("# Sources: ").append(String.join(", ", contributors)).append('\n');
        for (Slot s : merged.values()) {
            sb.append('\n');
            sb.append("# ").append(s.block.id()).append(" from ").append(s.modId).append('\n');
            sb.append(s.block.render()).append('\n');
        }
        return sb.toString();
    }
}
