package sh.harold.tidybox.core.permission;

/**
 * Which folders a probe run touches.
 */
public enum ProbePass {
    /**
     * Safe at launch: folders that could raise a consent prompt stay unchecked.
     */
    STARTUP,
    FULL;

    public boolean includes(FolderAccessInfo folder) {
        return this == FULL || !folder.canTriggerConsentDialog();
    }
}
