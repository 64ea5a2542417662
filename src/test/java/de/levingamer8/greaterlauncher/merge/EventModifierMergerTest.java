package de.levingamer8.greaterlauncher.merge;

import de.levingamer8.greaterlauncher.mods.Mod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static de.levingamer8.greaterlauncher.ModFixtures.mod;
import static de.levingamer8.greaterlauncher.ModFixtures.writeFragment;
import static org.junit.jupiter.api.Assertions.*;

class EventModifierMergerTest {

    @TempDir
    Path modsRoot;

    private final EventModifierMerger merger = new EventModifierMerger();
    private Mod a;
    private Mod b;
    private Path output;

    @BeforeEach
    void setUp() {
        a = mod(modsRoot, "A");
        b = mod(modsRoot, "B");
        output = modsRoot.resolve("z_launcher").resolve("common").resolve("event_modifiers.txt");
    }

    @Test
    void merge_laterModShouldWinConflictingBlock() throws Exception {
        writeFragment(a.path(), "X = { icon = 1 }\nonly_a = { icon = 5 }\n");
        writeFragment(b.path(), "X = { icon = 2 }\n");

        MergeReport report = merger.merge(List.of(a, b), output);

        String merged = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(merged.contains("# X from B\nX = { icon = 2 }\n"));
        assertFalse(merged.contains("icon = 1"));
        assertTrue(merged.contains("# only_a from A\nonly_a = { icon = 5 }\n"));
        assertTrue(merged.indexOf("X = ") < merged.indexOf("only_a = "), "first appearance fixes the position");

        assertEquals(2, report.blockCount());
        assertEquals(List.of("A", "B"), report.contributingMods());
        assertEquals(List.of(new MergeReport.BlockOverride("X", "A", "B", false)), report.overrides());
    }

    @Test
    void merge_orderShouldDecideWinner() throws Exception {
        writeFragment(a.path(), "X = { icon = 1 }\n");
        writeFragment(b.path(), "X = { icon = 2 }\n");

        merger.merge(List.of(b, a), output);

        assertTrue(Files.readString(output).contains("X = { icon = 1 }"));
    }

    @Test
    void merge_shouldBeDeterministic() throws Exception {
        writeFragment(a.path(), "X = {\n\ticon = 1\n}\nY = 2\n");
        writeFragment(b.path(), "Z = { icon = 3 }\nX = { icon = 4 }\n");

        merger.merge(List.of(a, b), output);
        byte[] first = Files.readAllBytes(output);
        merger.merge(List.of(a, b), output);

        assertArrayEquals(first, Files.readAllBytes(output));
    }

    @Test
    void merge_shouldSkipModsWithoutFragment() throws Exception {
        writeFragment(b.path(), "X = 1\n");

        MergeReport report = merger.merge(List.of(a, b), output);

        assertEquals(List.of("B"), report.contributingMods());
        assertEquals(EventModifierMerger.HEADER + "# Sources: B\n\n# X from B\nX = 1\n", Files.readString(output));
    }

    @Test
    void merge_identicalRedefinitionShouldBeReportedAsIdentical() throws Exception {
        writeFragment(a.path(), "X = 1\n");
        writeFragment(b.path(), "X = 1\n");

        MergeReport report = merger.merge(List.of(a, b), output);

        assertTrue(report.overrides().get(0).identical());
    }

    @Test
    void merge_malformedFragmentShouldNameModFileAndLine() throws IOException {
        writeFragment(a.path(), "X = 1\n");
        Path broken = writeFragment(b.path(), "ok = 1\nbad = {\n");

        MergeConflictException e = assertThrows(MergeConflictException.class, () -> merger.merge(List.of(a, b), output));

        assertEquals("B", e.modId());
        assertEquals(broken, e.file());
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains("'B'"));
        assertFalse(Files.exists(output), "nothing is written when a fragment fails");
    }

    @Test
    void merge_unreadableFragmentShouldFail() throws IOException {
        Files.createDirectories(a.eventModifiersFile());

        MergeConflictException e = assertThrows(MergeConflictException.class, () -> merger.merge(List.of(a), output));

        assertEquals("A", e.modId());
        assertEquals(0, e.line());
    }

    @Test
    void merge_shouldCopyBlockBytesUnchangedWhateverTheEncoding() throws Exception {
        byte[] latin1 = "cafe = { name = \"caf\u00e9\" }\n".getBytes(StandardCharsets.ISO_8859_1);
        byte[] utf8 = "bier = { name = \"m\u00fcnchen \u00c5lborg\" }\n".getBytes(StandardCharsets.UTF_8);
        write(a.eventModifiersFile(), latin1);
        write(b.eventModifiersFile(), utf8);

        merger.merge(List.of(a, b), output);

        byte[] merged = Files.readAllBytes(output);
        assertTrue(containsBytes(merged, latin1), "Latin-1 block copied as is");
        assertTrue(containsBytes(merged, utf8), "UTF-8 block copied as is");
    }

    @Test
    void merge_shouldIgnoreUtf8ByteOrderMark() throws Exception {
        byte[] body = "X = { icon = 1 }\n".getBytes(StandardCharsets.US_ASCII);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);
        write(a.eventModifiersFile(), withBom);
        writeFragment(b.path(), "X = { icon = 2 }\n");

        MergeReport report = merger.merge(List.of(a, b), output);

        assertEquals(1, report.blockCount());
        assertEquals(List.of(new MergeReport.BlockOverride("X", "A", "B", false)), report.overrides());
    }

    private static void write(Path file, byte[] bytes) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, bytes);
    }

    private static boolean containsBytes(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i + needle.length <= haystack.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) continue outer;
            }
            return true;
        }
        return false;
    }
}
