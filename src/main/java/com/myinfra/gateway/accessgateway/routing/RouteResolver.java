package com.myinfra.gateway.accessgateway.routing;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Finds the route mapping for a request path and rewrites the path for the backend.
 * The mapping list is fixed at construction.
 */
@Slf4j
public class RouteResolver {

    private final List<RouteMapping> mappings;

    public RouteResolver(List<RouteMapping> mappings) {
        this.mappings = List.copyOf(mappings);
    }

    /**
     * Returns the first mapping, in configuration order, whose pattern matches the path.
     * Declared priorities are not consulted.
     *
     * @param path Full request path, query string included (e.g., "/api/users?page=2")
     * @return the matching mapping, or empty if none matches
     */
    public Optional<RouteMapping> findMapping(String path) {
        if (path == null) {
            return Optional.empty();
        }
        return mappings.stream()
                .filter(mapping -> mapping.matches(path))
                .findFirst();
    }

    /**
     * Applies the mapping's transformation to the path.
     * <ol>
     *     <li>A rewrite wins. When the pattern has a group and the template references one,
     *     the first match is replaced with group interpolation; otherwise the template replaces
     *     the whole path.</li>
     *     <li>Otherwise stripPrefix removes the matched text and keeps a leading slash.</li>
     *     <li>Otherwise the path is returned unchanged.</li>
     * </ol>
     *
     * @param path    Original request path
     * @param mapping Mapping selected for the path
     * @return path to send to the backend
     */
    public String transform(String path, RouteMapping mapping) {
        RouteTransformation transformation = mapping.transformation();
        if (transformation == null) {
            return path;
        }

        log.debug("Transform route start: path={} pattern={} stripPrefix={} rewrite={}",
                path, mapping.pattern().pattern(), transformation.stripPrefix(), transformation.rewrite());

        if (transformation.hasRewrite()) {
            return rewrite(path, mapping, transformation.rewrite());
        }

        if (transformation.stripPrefix()) {
            return stripPrefix(path, mapping);
        }

        return path;
    }

    public List<RouteMapping> getMappings() {
        return mappings;
    }

    private String rewrite(String path, RouteMapping mapping, String template) {
        Matcher matcher = mapping.pattern().matcher(path);
        if (!matcher.find()) {
            log.warn("Rewrite requested but pattern did not match: path={} pattern={} rewrite={}",
                    path, mapping.pattern().pattern(), template);
            return path;
        }

        if (mapping.pattern().pattern().contains("(") && template.contains("$")) {
            String rewritten = path.substring(0, matcher.start())
                    + expand(template, matcher, path)
                    + path.substring(matcher.end());
            log.debug("Applied rewrite with capture groups: {} -> {}", path, rewritten);
            return rewritten;
        }

        log.debug("Applied literal rewrite: {} -> {}", path, template);
        return template;
    }

    /**
     * Expands {@code $n}, {@code $nn}, {@code $&}, {@code $`}, {@code $'} and {@code $$} against the
     * current match. A reference to a group the pattern does not have, or any other {@code $},
     * is copied literally. An unmatched group expands to nothing.
     */
    static String expand(String template, Matcher matcher, String input) {
        StringBuilder sb = new StringBuilder(template.length() + 16);
        int groupCount = matcher.groupCount();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c != '$' || i + 1 >= template.length()) {
                sb.append(c);
                i++;
                continue;
            }

            char next = template.charAt(i + 1);
            if (next == '$') {
                sb.append('$');
                i += 2;
            } else if (next == '&') {
                sb.append(matcher.group());
                i += 2;
            } else if (next == '`') {
                sb.append(input, 0, matcher.start());
                i += 2;
            } else if (next == '\'') {
                sb.append(input, matcher.end(), input.length());
                i += 2;
            } else if (Character.isDigit(next)) {
                int group = next - '0';
                int consumed = 2;
                if (i + 2 < template.length() && Character.isDigit(template.charAt(i + 2))) {
                    int twoDigit = group * 10 + (template.charAt(i + 2) - '0');
                    if (twoDigit >= 1 && twoDigit <= groupCount) {
                        group = twoDigit;
                        consumed = 3;
                    }
                }
                if (group >= 1 && group <= groupCount) {
                    String value = matcher.group(group);
                    sb.append(value == null ? "" : value);
                } else {
                    sb.append(template, i, i + consumed);
                }
                i += consumed;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private String stripPrefix(String path, RouteMapping mapping) {
        Matcher matcher = mapping.pattern().matcher(path);
        if (!matcher.find()) {
            log.warn("stripPrefix requested but pattern did not match: path={} pattern={}",
                    path, mapping.pattern().pattern());
            return path;
        }

        String prefix = matcher.group();
        int at = path.indexOf(prefix);
        String stripped = path.substring(0, at) + path.substring(at + prefix.length());

        if (stripped.isEmpty()) {
            stripped = "/";
        } else if (!stripped.startsWith("/")) {
            stripped = "/" + stripped;
        }

        log.debug("Applied stripPrefix: {} -> {} (matched '{}')", path, stripped, prefix);
        return stripped;
    }
}
