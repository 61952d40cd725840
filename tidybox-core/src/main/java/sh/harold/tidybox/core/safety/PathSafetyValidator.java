package sh.harold.tidybox.core.safety;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a path may be deleted.
 *
 * <p>Deletion is denied unless the path lies inside one of the policy's allowed roots. Rules are
 * evaluated in a fixed order and the first one that matches decides:
 * <ol>
 *   <li>blank, unparseable or relative paths are {@link ValidationOutcome#INVALID_PATH}</li>
 *   <li>a {@code ..} segment in the original input is {@link ValidationOutcome#PATH_TRAVERSAL},
 *       even when the normalized path would be allowed</li>
 *   <li>an exact protected entry, or a protected home subdirectory, is
 *       {@link ValidationOutcome#PROTECTED_PATH}</li>
 *   <li>anything not inside an allowed root is {@link ValidationOutcome#OUTSIDE_ALLOWED_PATHS}</li>
 *   <li>a symlink whose target escapes into protected territory, or a path reached through a
 *       symlinked ancestor, is {@link ValidationOutcome#SYMLINK_TO_PROTECTED}</li>
 * </ol>
 *
 * <p>Instances hold no mutable state and are safe to share between threads.
 */
public final class PathSafetyValidator {
    private static final String HOME_TOKEN = "~";
    private static final String PARENT_SEGMENT = "..";
    private static final Set<String> CACHE_OR_TRASH_SEGMENTS = Set.of("Caches", ".Trash", "Trash", ".cache");

    private final SafetyPolicy policy;

    public PathSafetyValidator(SafetyPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public SafetyPolicy policy() {
        return policy;
    }

    public ValidationResult validate(Path path) {
        return validate(path == null ? null : path.toString());
    }

    public ValidationResult validate(String path) {
        if (path == null || path.isBlank()) {
            return ValidationResult.invalidPath();
        }
        String trimmed = path.strip();

        Path raw;
        try {
            raw = Path.of(expandHome(trimmed));
        } catch (InvalidPathException e) {
            return ValidationResult.invalidPath();
        }
        Path normalized = raw.normalize();

        if (hasParentSegment(trimmed)) {
            return ValidationResult.pathTraversal();
        }
        if (!normalized.isAbsolute()) {
            return ValidationResult.invalidPath();
        }

        if (policy.protectedPaths().contains(normalized)) {
            return ValidationResult.protectedPath(normalized.toString());
        }
        if (policy.protectedHomePaths().contains(normalized)) {
            return ValidationResult.protectedPath(normalized.toString());
        }

        Optional<AllowedRoot> root = allowedRootFor(normalized);
        if (root.isEmpty()) {
            return ValidationResult.outsideAllowedPaths();
        }

        if (escapesThroughSymlink(normalized, root.get())) {
            return ValidationResult.symlinkToProtected();
        }
        return ValidationResult.safe();
    }

    /**
     * Validates each path independently. Results keep the input order.
     */
    public List<PathValidation> validateBatch(List<String> paths) {
        Objects.requireNonNull(paths, "paths");
        return paths.parallelStream()
            .map(path -> new PathValidation(path, validate(path)))
            .toList();
    }

    /**
     * Keeps only the paths that validate as safe, in input order.
     */
    public List<String> filterSafePaths(List<String> paths) {
        Objects.requireNonNull(paths, "paths");
        return paths.stream()
            .filter(path -> validate(path).isSafe())
            .toList();
    }

    public String expandHome(String path) {
        if (path.equals(HOME_TOKEN)) {
            return policy.home().toString();
        }
        if (path.startsWith(HOME_TOKEN + "/")) {
            return policy.home() + path.substring(HOME_TOKEN.length());
        }
        return path;
    }

    private Optional<AllowedRoot> allowedRootFor(Path normalized) {
        for (AllowedRoot root : policy.allowedRoots()) {
            if (root.permits(normalized)) {
                return Optional.of(root);
            }
        }
        return Optional.empty();
    }

    private boolean escapesThroughSymlink(Path normalized, AllowedRoot root) {
        if (Files.isSymbolicLink(normalized) && linkTargetIsProtected(normalized)) {
            return true;
        }
        if (normalized.equals(root.path())) {
            return false;
        }
        Path parent = normalized.getParent();
        if (parent == null || !Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try {
            Path realParent = parent.toRealPath();
            return !realParent.startsWith(realPathOrSelf(root.path()));
        } catch (IOException | SecurityException e) {
            return true;
        }
    }

    private boolean linkTargetIsProtected(Path link) {
        Path target;
        try {
            target = Files.readSymbolicLink(link);
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            return true;
        }
        if (!target.isAbsolute()) {
            Path parent = link.getParent();
            target = parent == null ? target.toAbsolutePath() : parent.resolve(target);
        }
        Path resolved = target.normalize();
        if (insideCacheOrTrash(resolved)) {
            return false;
        }
        for (Path protectedPath : policy.protectedPaths()) {
            if (resolved.startsWith(protectedPath)) {
                return true;
            }
        }
        for (Path protectedPath : policy.protectedHomePaths()) {
            if (resolved.startsWith(protectedPath)) {
                return true;
            }
        }
        return false;
    }

    private static boolean insideCacheOrTrash(Path path) {
        Path parent = path.getParent();
        if (parent == null) {
            return false;
        }
        for (Path segment : parent) {
            if (CACHE_OR_TRASH_SEGMENTS.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    private static Path realPathOrSelf(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException | SecurityException e) {
            return path;
        }
    }

    private static boolean hasParentSegment(String path) {
        for (String segment : path.split("/", -1)) {
            if (segment.equals(PARENT_SEGMENT)) {
                return true;
            }
        }
        return false;
    }
}
