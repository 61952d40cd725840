package sh.harold.tidybox.core.delete;

public enum FailureKind {
    INVALID_INPUT,
    POLICY_VIOLATION,
    NOT_FOUND,
    PERMISSION_DENIED,
    ENUMERATION_FAILURE,
    ALREADY_IN_TRASH,
    IO_FAILURE
}
