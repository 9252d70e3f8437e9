package ai.repld.repl;

import org.jetbrains.annotations.Nullable;

/** Formats diagnostics for human consumption. */
public enum MessageRenderer {
    PLAIN_RELATIVE_PATHS {
        @Override
        public String render(MessageSeverity severity, String message, @Nullable MessageLocation location) {
            var prefix = location == null ? "" : location + ": ";
            var rendered = prefix + severity.presentableName() + ": " + message;
            var lineContent = location == null ? null : location.lineContent();
            if (lineContent == null) {
                return rendered;
            }
            var sb = new StringBuilder(rendered).append('\n').append(lineContent);
            if (location.column() > 0) {
                sb.append('\n').append(" ".repeat(location.column() - 1)).append('^');
            }
            return sb.toString();
        }
    },
    WITHOUT_PATHS {
        @Override
        public String render(MessageSeverity severity, String message, @Nullable MessageLocation location) {
            return severity.presentableName() + ": " + message;
        }
    };

    public abstract String render(MessageSeverity severity, String message, @Nullable MessageLocation location);
}
