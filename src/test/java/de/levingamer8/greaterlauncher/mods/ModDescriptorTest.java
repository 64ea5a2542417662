package de.levingamer8.greaterlauncher.mods;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModDescriptorTest {

    @Test
    void parse_shouldHandleMultiLineDependenciesAndComments() {
        String content = """
                # Pop Demand
                name = "Pop Demand Mod" // display name
                path = mod\\PDM\\
                dependencies = {
                    "Base Mod"   # first
                    Other
                }
                github = https://github.com/someone/pdm
                """;

        ModDescriptor d = ModDescriptor.parse(content);

        assertEquals("Pop Demand Mod", d.name());
        assertEquals("PDM", d.folderName());
        assertEquals(List.of("Base Mod", "Other"), d.dependencies());
        assertEquals("https://github.com/someone/pdm", d.github());
        assertEquals("", d.userDir());
        assertNull(d.version());
    }

    @Test
    void parse_shouldIgnoreUnknownKeysAndBlankValues() {
        ModDescriptor d = ModDescriptor.parse("name = \"\"\nreplace_path = \"history\"\n");

        assertNull(d.name());
        assertNull(d.path());
        assertNull(d.folderName());
    }
}
