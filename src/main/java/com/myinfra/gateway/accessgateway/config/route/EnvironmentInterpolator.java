package com.myinfra.gateway.accessgateway.config.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.PropertyResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${VAR}} and {@code ${VAR:default}} tokens with values from the environment.
 * A token whose variable is unset and which has no default is left in place.
 */
@RequiredArgsConstructor
public class EnvironmentInterpolator {

    private static final Pattern TOKEN = Pattern.compile("\\$\\{([^}]+)}");

    private final PropertyResolver environment;

    public String interpolate(String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        Matcher matcher = TOKEN.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolve(matcher.group(1), matcher.group())));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Interpolates every string value of a JSON tree in place. Field names are left untouched.
     *
     * @param node Root of the tree
     * @return the same node, or a replacement when the root itself is a string
     */
    public JsonNode interpolate(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return TextNode.valueOf(interpolate(node.asText()));
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, interpolate(array.get(i)));
            }
        } else if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                object.set(name, interpolate(object.get(name)));
            }
        }
        return node;
    }

    /**
     * Looks up a single variable, falling back to the given default when unset or empty.
     */
    public String lookup(String name, String defaultValue) {
        String value = environment.getProperty(name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private String resolve(String expression, String token) {
        int colon = expression.indexOf(':');
        String name = colon < 0 ? expression : expression.substring(0, colon);
        String defaultValue = colon < 0 ? "" : expression.substring(colon + 1);

        String value = environment.getProperty(name);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        if (!defaultValue.isEmpty()) {
            return defaultValue;
        }
        return token;
    }
}
