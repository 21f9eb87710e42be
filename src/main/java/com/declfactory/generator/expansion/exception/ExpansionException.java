package com.declfactory.generator.expansion.exception;

import com.github.javaparser.ast.Node;

/**
 * Fatal failure while expanding templates.
 * There is no recoverable tier: the expansion of the whole source is abandoned.
 */
public class ExpansionException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private static final int MAX_SUMMARY_LENGTH = 80;

    private final String location;

    public ExpansionException(String message) {
        super(message);
        this.location = null;
    }

    public ExpansionException(String message, Node site) {
        this(message, site, null);
    }

    public ExpansionException(String message, Node site, Throwable cause) {
        super(withLocation(message, describe(site)), cause);
        this.location = describe(site);
    }

    /**
     * Where the failure happened, as "line N: first line of the declaration", if known.
     */
    public String getLocation() {
        return location;
    }

    private static String withLocation(String message, String location) {
        return location == null ? message : message + " (at " + location + ")";
    }

    /**
     * Short one-line description of a node for error messages.
     */
    public static String describe(Node node) {
        if (node == null) {
            return null;
        }
        String line = node.getBegin().map(p -> "line " + p.line + ": ").orElse("");
        return line + summary(node);
    }

    private static String summary(Node node) {
        for (String text : node.toString().split("\\R")) {
            String trimmed = text.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("/") || trimmed.startsWith("*")) {
                continue;
            }
            return trimmed.length() > MAX_SUMMARY_LENGTH
                    ? trimmed.substring(0, MAX_SUMMARY_LENGTH) + "..."
                    : trimmed;
        }
        return node.getClass().getSimpleName();
    }
}
