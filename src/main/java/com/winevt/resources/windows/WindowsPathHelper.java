package com.winevt.resources.windows;

import com.winevt.resources.core.model.EnvironmentVariable;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Windows path expansion and normalization.
 */
public final class WindowsPathHelper {

    static final String DEFAULT_SYSTEM_DIRECTORY = "%SystemRoot%\\System32";

    private static final Pattern ENVIRONMENT_VARIABLE = Pattern.compile("%([^%\\\\]+)%");

    private WindowsPathHelper() {
        // utility class
    }

    /**
     * Expands {@code %NAME%} references; names are matched case-insensitively and
     * unknown references are left as is.
     *
     * @param path                 the Windows path
     * @param environmentVariables the environment variables, may be empty
     * @return the expanded path
     */
    public static String expandWindowsPath(String path, List<EnvironmentVariable> environmentVariables) {
        if (path == null || environmentVariables == null || environmentVariables.isEmpty()) {
            return path;
        }
        Map<String, String> values = new HashMap<>();
        for (EnvironmentVariable variable : environmentVariables) {
            if (variable.getName() != null && variable.getValue() != null) {
                values.putIfAbsent(variable.getName().toLowerCase(Locale.ROOT), variable.getValue());
            }
        }

        Matcher matcher = ENVIRONMENT_VARIABLE.matcher(path);
        StringBuilder expanded = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1).toLowerCase(Locale.ROOT));
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(expanded);
        return expanded.toString();
    }

    /**
     * Normalizes a message file path as defined by an EventLog provider.
     *
     * <p>{@code \SystemRoot\} is rewritten to {@code %SystemRoot%\}, the {@code \??\} prefix
     * is removed, environment variables are expanded and the drive letter is stripped.
     * A bare filename is placed in {@code %SystemRoot%\System32}.</p>
     *
     * @param path                 the Windows path
     * @param environmentVariables the environment variables, may be empty
     * @return the system path and filename, or null if the path is null or blank
     */
    public static WindowsSystemPath getWindowsSystemPath(
            String path, List<EnvironmentVariable> environmentVariables) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String normalized = path.trim();
        if (normalized.toLowerCase(Locale.ROOT).startsWith("\\systemroot\\")) {
            normalized = "%SystemRoot%" + normalized.substring("\\systemroot".length());
        } else if (normalized.startsWith("\\??\\")) {
            normalized = normalized.substring(4);
        }
        normalized = expandWindowsPath(normalized, environmentVariables);

        int separator = normalized.lastIndexOf('\\');
        String directory = separator >= 0 ? normalized.substring(0, separator) : "";
        String filename = normalized.substring(separator + 1);

        if (directory.isEmpty()) {
            directory = expandWindowsPath(DEFAULT_SYSTEM_DIRECTORY, environmentVariables);
        }
        if (directory.length() >= 2 && directory.charAt(1) == ':' && Character.isLetter(directory.charAt(0))) {
            directory = directory.substring(2);
        }
        return new WindowsSystemPath(directory, filename);
    }
}
