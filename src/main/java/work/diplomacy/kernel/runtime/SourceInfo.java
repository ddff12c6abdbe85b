package work.diplomacy.kernel.runtime;

import java.util.Optional;
import java.util.Set;

/**
 * Declaration site of a module, captured from the caller's stack frame.
 */
public record SourceInfo(String fileName, int line) {
    private static final SourceInfo UNKNOWN = new SourceInfo(null, -1);
    private static final Set<String> SKIPPED = Set.of(
        SourceInfo.class.getName(),
        ElaborationContext.class.getName()
    );

    public static SourceInfo unknown() {
        return UNKNOWN;
    }

    /**
     * First frame outside the context, i.e. the author's call site.
     */
    static SourceInfo capture() {
        Optional<StackWalker.StackFrame> frame = StackWalker.getInstance().walk(frames -> frames
            .filter(f -> !SKIPPED.contains(f.getClassName()))
            .findFirst());
        return frame
            .filter(f -> f.getFileName() != null)
            .map(f -> new SourceInfo(f.getFileName(), f.getLineNumber()))
            .orElse(UNKNOWN);
    }

    public boolean isUnknown() {
        return fileName == null;
    }

    public String render() {
        return isUnknown() ? "" : "(" + fileName + ":" + line + ")";
    }
}
