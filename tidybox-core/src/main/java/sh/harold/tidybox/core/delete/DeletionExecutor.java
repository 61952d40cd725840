package sh.harold.tidybox.core.delete;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sh.harold.tidybox.core.concurrent.CancellationToken;
import sh.harold.tidybox.core.safety.PathSafetyValidator;
import sh.harold.tidybox.core.safety.ValidationOutcome;
import sh.harold.tidybox.core.safety.ValidationResult;

/**
 * Moves validated candidates to the trash one at a time.
 *
 * <p>Every candidate is validated immediately before it is trashed; nothing that fails
 * validation reaches the {@link TrashService}. A failure never stops the rest of the batch.
 */
public final class DeletionExecutor {
    private final PathSafetyValidator validator;
    private final TrashService trash;
    private final System.Logger logger;

    public DeletionExecutor(PathSafetyValidator validator, TrashService trash, System.Logger logger) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.trash = Objects.requireNonNull(trash, "trash");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Runs the batch. A session cancelled before the call does nothing; once started, the batch
     * runs to the end.
     */
    public DeletionResult execute(List<DeletionCandidate> candidates, CancellationToken token) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(token, "token");
        if (token.isCancelled()) {
            logger.log(System.Logger.Level.INFO, "Deletion session cancelled; batch of " + candidates.size() + " not started");
            return DeletionResult.empty();
        }

        int succeeded = 0;
        long freed = 0L;
        List<DeletionError> errors = new ArrayList<>();
        for (DeletionCandidate candidate : candidates) {
            DeletionError error = deleteOne(candidate);
            if (error == null) {
                succeeded++;
                freed += candidate.sizeBytes();
            } else {
                errors.add(error);
            }
        }

        DeletionResult result = new DeletionResult(succeeded, errors.size(), errors, freed);
        logger.log(System.Logger.Level.INFO, "Moved " + succeeded + " of " + candidates.size()
            + " items to the trash, freed " + freed + " bytes, " + errors.size() + " failed");
        return result;
    }

    private DeletionError deleteOne(DeletionCandidate candidate) {
        String raw = candidate.path();
        ValidationResult verdict = validator.validate(raw);
        if (!verdict.isSafe()) {
            FailureKind kind = verdict.outcome() == ValidationOutcome.INVALID_PATH
                ? FailureKind.INVALID_INPUT
                : FailureKind.POLICY_VIOLATION;
            logger.log(System.Logger.Level.DEBUG, "Refusing to delete " + raw + ": " + verdict.reason());
            return new DeletionError(raw, kind, verdict.reason());
        }

        Path path;
        try {
            path = Path.of(validator.expandHome(raw.strip())).normalize();
        } catch (InvalidPathException e) {
            return new DeletionError(raw, FailureKind.INVALID_INPUT, ValidationResult.invalidPath().reason());
        }
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return new DeletionError(raw, FailureKind.NOT_FOUND, ValidationResult.doesNotExist().reason());
        }

        try {
            trash.moveToTrash(path);
            return null;
        } catch (AccessDeniedException e) {
            logger.log(System.Logger.Level.WARNING, "Permission denied moving " + path + " to the trash", e);
            return new DeletionError(raw, FailureKind.PERMISSION_DENIED, "Permission denied");
        } catch (AlreadyInTrashException e) {
            logger.log(System.Logger.Level.DEBUG, "Skipping " + path + ": already in the trash");
            return new DeletionError(raw, FailureKind.ALREADY_IN_TRASH, e.getReason());
        } catch (NoSuchFileException e) {
            logger.log(System.Logger.Level.WARNING, "Vanished before it could be trashed: " + path);
            return new DeletionError(raw, FailureKind.NOT_FOUND, ValidationResult.doesNotExist().reason());
        } catch (IOException | SecurityException e) {
            logger.log(System.Logger.Level.WARNING, "Failed to move " + path + " to the trash", e);
            return new DeletionError(raw, FailureKind.IO_FAILURE, String.valueOf(e.getMessage()));
        }
    }
}
