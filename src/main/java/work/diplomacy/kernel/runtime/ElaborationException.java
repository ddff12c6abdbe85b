package work.diplomacy.kernel.runtime;

import java.util.Optional;

/**
 * Fatal elaboration failure. Carries a stable error code plus the offending module and its
 * declaration site when they are known.
 */
public class ElaborationException extends RuntimeException {
    private final String code;
    private final String moduleName;
    private final SourceInfo sourceInfo;

    public ElaborationException(String code, String message) {
        this(code, message, null, null);
    }

    public ElaborationException(String code, String message, String moduleName, SourceInfo sourceInfo) {
        super(message + (sourceInfo == null || sourceInfo.isUnknown() ? "" : " " + sourceInfo.render()));
        this.code = code;
        this.moduleName = moduleName;
        this.sourceInfo = sourceInfo;
    }

    public String code() {
        return code;
    }

    public Optional<String> moduleName() {
        return Optional.ofNullable(moduleName);
    }

    public Optional<SourceInfo> sourceInfo() {
        return Optional.ofNullable(sourceInfo);
    }
}
