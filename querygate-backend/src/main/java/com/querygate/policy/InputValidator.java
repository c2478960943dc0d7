package com.querygate.policy;

import com.querygate.config.GatewayProperties;
import com.querygate.model.QueryRequest;
import com.querygate.model.TextKind;
import com.querygate.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Stateless safety and size checks for incoming requests.
 *
 * <p>The outcome is a pure function of the request and the policy tables captured at
 * construction, so validating the same request twice always yields an equal result.
 */
@Slf4j
public class InputValidator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern IDENTIFIER_CHARS = Pattern.compile("[\\p{L}\\p{N}_ .\\-]+");
    private static final Pattern WINDOWS_ABSOLUTE = Pattern.compile("^([A-Za-z]:[\\\\/]|\\\\\\\\).*");
    private static final List<String> SUSPICIOUS_IDENTIFIER_FRAGMENTS = List.of("--", "/*", "*/", "XP_", "SP_", "DROP", "DELETE");

    private final int maxQueryLength;
    private final int maxIdentifierLength;
    private final int maxPathLength;
    private final int maxRuns;
    private final int maxRows;
    private final List<Pattern> denylist;
    private final Set<String> allowedExportExtensions;

    public InputValidator(GatewayProperties properties) {
        GatewayProperties.ValidationConfig validation = properties.getValidation();
        this.maxQueryLength = validation.getMaxQueryLength();
        this.maxIdentifierLength = validation.getMaxIdentifierLength();
        this.maxPathLength = validation.getMaxPathLength();
        this.maxRuns = properties.getExecution().getMaxRuns();
        this.maxRows = properties.getExecution().getSafetyMaxRows();
        this.denylist = validation.getDenylist().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.allowedExportExtensions = validation.getAllowedExportExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public ValidationResult validate(QueryRequest request) {
        if (request == null) {
            return ValidationResult.rejected("Request is required");
        }

        String text = request.getText();
        String sanitized;
        TextKind kind = request.getTextKind() != null ? request.getTextKind() : TextKind.QUERY;
        String reason;
        if (kind == TextKind.IDENTIFIER) {
            reason = checkIdentifier("identifier", text);
            sanitized = reason == null ? sanitizeIdentifier(text) : null;
        } else if (kind == TextKind.PATH) {
            reason = checkPath(text);
            sanitized = reason == null ? text.trim() : null;
        } else {
            reason = checkQuery(text);
            sanitized = reason == null ? text.trim() : null;
        }
        if (reason != null) {
            return ValidationResult.rejected(reason);
        }

        for (Map.Entry<String, String> identifier : request.getIdentifiers().entrySet()) {
            reason = checkIdentifier(identifier.getKey(), identifier.getValue());
            if (reason != null) {
                return ValidationResult.rejected(reason);
            }
        }

        if (request.getExportPath() != null) {
            reason = checkPath(request.getExportPath());
            if (reason != null) {
                return ValidationResult.rejected(reason);
            }
        }

        reason = checkRange("runs", request.getRuns(), 1, maxRuns);
        if (reason != null) {
            return ValidationResult.rejected(reason);
        }
        reason = checkRange("max_rows", request.getMaxRows(), 1, maxRows);
        if (reason != null) {
            return ValidationResult.rejected(reason);
        }

        return ValidationResult.ok(sanitized);
    }

    String checkQuery(String query) {
        if (query == null || query.isBlank()) {
            return "Query must be a non-empty string";
        }
        if (query.length() > maxQueryLength) {
            return "Query exceeds " + maxQueryLength + " characters";
        }
        if (query.indexOf('\0') >= 0) {
            return "Query contains null bytes";
        }

        for (String candidate : denylistCandidates(query)) {
            for (Pattern pattern : denylist) {
                if (pattern.matcher(candidate).find()) {
                    return "Query contains potentially dangerous pattern: " + pattern.pattern();
                }
            }
        }
        return null;
    }

    String checkIdentifier(String name, String value) {
        if (value == null || value.isBlank()) {
            return "Identifier '" + name + "' must be a non-empty string";
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxIdentifierLength) {
            return "Identifier '" + name + "' exceeds " + maxIdentifierLength + " characters";
        }
        if (trimmed.indexOf('\0') >= 0) {
            return "Identifier '" + name + "' contains null bytes";
        }
        if (trimmed.chars().anyMatch(c -> c < 32)) {
            return "Identifier '" + name + "' contains control characters";
        }
        if (!IDENTIFIER_CHARS.matcher(trimmed).matches()) {
            return "Identifier '" + name + "' may only contain letters, digits, underscore, space, hyphen and period";
        }

        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (SUSPICIOUS_IDENTIFIER_FRAGMENTS.stream().anyMatch(upper::contains)) {
            log.warn("Suspicious identifier accepted: {}={}", name, trimmed);
        }
        return null;
    }

    String checkPath(String path) {
        if (path == null || path.isBlank()) {
            return "Path must be a non-empty string";
        }
        if (path.length() > maxPathLength) {
            return "Path exceeds " + maxPathLength + " characters";
        }
        if (path.indexOf('\0') >= 0) {
            return "Path contains null bytes";
        }

        for (String segment : path.split("[\\\\/]")) {
            if ("..".equals(segment)) {
                return "Path traversal detected (..) - not allowed";
            }
        }

        if (!isAbsolute(path)) {
            return "Path must be absolute";
        }

        String fileName = path.replace('\\', '/');
        fileName = fileName.substring(fileName.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot > 0) {
            String ext = fileName.substring(dot).toLowerCase(Locale.ROOT);
            if (!allowedExportExtensions.contains(ext)) {
                return "File extension " + ext + " not allowed. Allowed: " + allowedExportExtensions.stream().sorted().toList();
            }
        }
        return null;
    }

    private boolean isAbsolute(String path) {
        if (WINDOWS_ABSOLUTE.matcher(path).matches()) {
            return true;
        }
        try {
            return Path.of(path).isAbsolute();
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private String checkRange(String name, Integer value, int min, int max) {
        if (value == null) {
            return null;
        }
        if (value < min) {
            return name + " must be >= " + min;
        }
        if (value > max) {
            return name + " must be <= " + max;
        }
        return null;
    }

    /**
     * Comment-free renderings of the query. Comments are removed both outright and as a
     * separator, so a keyword split by a comment and two keywords joined by one are both seen.
     */
    static List<String> denylistCandidates(String query) {
        List<String> out = new ArrayList<>(3);
        out.add(collapse(stripComments(query, "")));
        out.add(collapse(stripComments(query, " ")));
        out.add(collapse(query));
        return out;
    }

    /**
     * Single left-to-right pass: whichever of block comment, line comment or string literal
     * opens first is consumed whole, so comment markers inside another comment or inside a
     * literal are plain text. Literal contents are kept; an unterminated comment runs to the end.
     */
    static String stripComments(String query, String replacement) {
        StringBuilder out = new StringBuilder(query.length());
        int i = 0;
        int n = query.length();
        while (i < n) {
            char c = query.charAt(i);
            char next = i + 1 < n ? query.charAt(i + 1) : '\0';
            if (c == '/' && next == '*') {
                int end = query.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
                out.append(replacement);
            } else if ((c == '-' && next == '-') || (c == '/' && next == '/')) {
                while (i < n && query.charAt(i) != '\n' && query.charAt(i) != '\r') {
                    i++;
                }
                out.append(replacement);
            } else if (c == '"' || c == '\'') {
                int end = literalEnd(query, i, c);
                out.append(query, i, end);
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Index just past the literal opened at {@code start}; a doubled quote is an escaped quote.
     */
    private static int literalEnd(String query, int start, char quote) {
        int i = start + 1;
        while (i < query.length()) {
            if (query.charAt(i) == quote) {
                if (i + 1 < query.length() && query.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return query.length();
    }

    private static String collapse(String s) {
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    static String sanitizeIdentifier(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if (c >= 32) {
                sb.append(c);
            }
        }
        return sb.toString().trim();
    }
}
