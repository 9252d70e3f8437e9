package ai.repld.repl;

import org.jetbrains.annotations.Nullable;

/**
 * Source position a diagnostic refers to. Lines and columns are 1-based; -1 means unknown.
 *
 * @param path the file or pseudo-file the code line came from
 * @param line start line
 * @param column start column
 * @param lineEnd end line
 * @param columnEnd end column
 * @param lineContent the text of the offending line, if known
 */
public record MessageLocation(
        String path, int line, int column, int lineEnd, int columnEnd, @Nullable String lineContent) {

    public MessageLocation {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
    }

    public static MessageLocation of(String path, int line, int column) {
        return new MessageLocation(path, line, column, -1, -1, null);
    }

    @Override
    public String toString() {
        if (line < 0) {
            return path;
        }
        return column < 0 ? path + ":" + line : path + ":" + line + ":" + column;
    }
}
