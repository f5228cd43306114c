package com.myinfra.gateway.accessgateway.routing;

import com.myinfra.gateway.accessgateway.exception.GatewayConfigurationException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns the declarative pattern of a route mapping into a compiled {@link Pattern}.
 */
public final class PatternCompiler {

    private static final String REGEX_METACHARACTERS = ".*+?^${}()|[]\\";

    private PatternCompiler() {
    }

    /**
     * Compiles a pattern of the given kind.
     * <ul>
     *     <li>{@code exact}: the literal path, anchored on both ends</li>
     *     <li>{@code glob}: {@code *} matches any run of characters, {@code ?} a single one, anchored</li>
     *     <li>{@code regex}: compiled as written, not anchored</li>
     * </ul>
     *
     * @param pattern Raw pattern from configuration
     * @param kind    Pattern kind, null meaning regex
     * @return the compiled pattern
     * @throws GatewayConfigurationException if the pattern is blank or not a valid expression
     */
    public static Pattern compile(String pattern, PatternKind kind) {
        if (pattern == null || pattern.isEmpty()) {
            throw new GatewayConfigurationException("Route mapping pattern must not be empty");
        }

        PatternKind effective = kind == null ? PatternKind.REGEX : kind;
        String source = switch (effective) {
            case EXACT -> "^" + escape(pattern) + "$";
            case GLOB -> "^" + escape(pattern).replace("\\*", ".*").replace("\\?", ".") + "$";
            case REGEX -> pattern;
        };

        try {
            return Pattern.compile(source);
        } catch (PatternSyntaxException e) {
            throw new GatewayConfigurationException(
                    "Invalid " + effective.value() + " pattern '" + pattern + "': " + e.getDescription(), e);
        }
    }

    static String escape(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
