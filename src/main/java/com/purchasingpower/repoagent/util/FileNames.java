package com.purchasingpower.repoagent.util;

import java.util.Locale;

public final class FileNames {

    public static final String NO_EXTENSION = "no-extension";
    public static final String UNKNOWN_EXTENSION = "unknown";

    private FileNames() {
    }

    /**
     * Last path segment of a slash separated path.
     */
    public static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Lower-cased extension of the last path segment, {@value #NO_EXTENSION} when the
     * name has no dot and {@value #UNKNOWN_EXTENSION} when it ends with one.
     */
    public static String extension(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return NO_EXTENSION;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.isEmpty() ? UNKNOWN_EXTENSION : ext;
    }

    /**
     * Strips leading slashes so callers may pass {@code /src/App.java} or {@code src/App.java}.
     */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.trim();
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
