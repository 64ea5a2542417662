package de.levingamer8.greaterlauncher.merge;

/**
 * One top-level {@code id = value} entry of a fragment file.
 *
 * @param id      block identifier (the key)
 * @param content everything after {@code =}, possibly spanning lines ({@code \n} separated)
 * @param line    1-based line the block starts on
 */
public record FragmentBlock(String id, String content, int line) {

    public String render() {
        return id + " = " + content;
    }
}
