package io.echoprompt.core.context;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rules for {@code #context(...)} paths. A path is either a bare asset file
 * name ({@code hero-image.png}) or a {@code plp://assetId} reference. Path
 * traversal, external URLs and percent-encoded characters are rejected.
 */
public final class ContextPaths {

    public static final String PLP_PREFIX = "plp://";

    private static final Pattern ASSET_ID = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");
    private static final Pattern FILE_NAME = Pattern.compile("^[A-Za-z0-9_.-]{1,128}$");

    private ContextPaths() {}

    public static boolean isPlpReference(String path) {
        return path.startsWith(PLP_PREFIX);
    }

    /** The asset id of a {@code plp://} reference, or the path unchanged. */
    public static String assetId(String path) {
        return isPlpReference(path) ? path.substring(PLP_PREFIX.length()) : path;
    }

    /** Returns why {@code path} is invalid, or empty when it is acceptable. */
    public static Optional<String> validate(String path) {
        if (path == null || path.isBlank()) {
            return Optional.of("Context path cannot be empty");
        }
        if (path.contains("..")) {
            return Optional.of("Context path cannot contain path traversal (..)");
        }
        if (path.contains("://") && !isPlpReference(path)) {
            return Optional.of("Only plp:// references are allowed (no external URLs)");
        }
        if (path.contains("%")) {
            return Optional.of("Context path cannot contain encoded characters");
        }
        if (isPlpReference(path)) {
            if (!ASSET_ID.matcher(assetId(path)).matches()) {
                return Optional.of("Invalid asset ID: must be 1-64 alphanumeric characters, hyphens, or underscores");
            }
        } else if (!FILE_NAME.matcher(path).matches()) {
            return Optional.of(
                    "Invalid context name: must be 1-128 alphanumeric characters, hyphens, underscores, or dots");
        }
        return Optional.empty();
    }

    public static boolean isValid(String path) {
        return validate(path).isEmpty();
    }
}
