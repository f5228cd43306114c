package com.myinfra.gateway.accessgateway.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class RouteResolverTest {

    private static RouteMapping mapping(String regex, String service, RouteTransformation transformation) {
        return RouteMapping.of(Pattern.compile(regex), service, transformation);
    }

    @Nested
    class FindMapping {

        @Test
        @DisplayName("first matching mapping in configuration order wins")
        void firstMatchWins() {
            RouteMapping broad = new RouteMapping("broad", Pattern.compile("^/api/"), "core",
                    null, 1, null, null);
            RouteMapping specific = new RouteMapping("specific", Pattern.compile("^/api/auth/"), "auth",
                    null, 100, null, null);
            RouteResolver resolver = new RouteResolver(List.of(broad, specific));

            assertThat(resolver.findMapping("/api/auth/login")).contains(broad);
        }

        @Test
        @DisplayName("the query string takes part in matching")
        void matchesAgainstQueryString() {
            RouteMapping byQuery = mapping("tenant=acme", "acme", null);
            RouteMapping fallback = mapping("^/api/", "core", null);
            RouteResolver resolver = new RouteResolver(List.of(byQuery, fallback));

            assertThat(resolver.findMapping("/api/users?tenant=acme")).contains(byQuery);
            assertThat(resolver.findMapping("/api/users?tenant=other")).contains(fallback);
        }

        @Test
        void noMatchIsEmpty() {
            RouteResolver resolver = new RouteResolver(List.of(mapping("^/api/auth/", "auth", null)));

            assertThat(resolver.findMapping("/metrics")).isEmpty();
            assertThat(resolver.findMapping(null)).isEmpty();
        }
    }

    @Nested
    class Transform {

        private final RouteResolver resolver = new RouteResolver(List.of());

        @ParameterizedTest
        @ValueSource(strings = {"/api/auth/login", "/api/auth/register", "/api/auth/refresh", "/api/auth/logout"})
        @DisplayName("a rewrite without $ references replaces the whole path even with capture groups")
        void literalRewriteReplacesWholePath(String path) {
            RouteMapping m = mapping("^/api/auth/(login|register|refresh|logout)", "auth",
                    new RouteTransformation(true, "/auth"));

            assertThat(resolver.transform(path, m)).isEqualTo("/auth");
        }

        @Test
        @DisplayName("a rewrite with $ references interpolates capture groups")
        void captureGroupRewrite() {
            RouteMapping m = mapping("^/api/auth/(.+)", "auth", new RouteTransformation(false, "/auth/$1"));

            assertThat(resolver.transform("/api/auth/login", m)).isEqualTo("/auth/login");
            assertThat(resolver.transform("/api/auth/user/profile", m)).isEqualTo("/auth/user/profile");
        }

        @Test
        @DisplayName("a $ template on a pattern without groups is used literally")
        void dollarWithoutGroupsIsLiteral() {
            RouteMapping m = mapping("^/api/price", "billing", new RouteTransformation(false, "/price$"));

            assertThat(resolver.transform("/api/price/today", m)).isEqualTo("/price$");
        }

        @Test
        @DisplayName("a reference to a group the pattern lacks stays literal")
        void missingGroupReferenceIsLiteral() {
            RouteMapping m = mapping("^/api/auth/(.+)", "auth", new RouteTransformation(false, "/auth/$2"));

            assertThat(resolver.transform("/api/auth/login", m)).isEqualTo("/auth/$2");
        }

        @Test
        @DisplayName("$& inserts the whole match")
        void wholeMatchReference() {
            RouteMapping m = mapping("^/api/(auth)", "auth", new RouteTransformation(false, "/v2$&"));

            assertThat(resolver.transform("/api/auth/login", m)).isEqualTo("/v2/api/auth/login");
        }

        @Test
        @DisplayName("a trailing or escaped $ on a grouped pattern is kept")
        void trailingAndEscapedDollar() {
            RouteMapping trailing = mapping("^/api/(price)", "billing", new RouteTransformation(false, "/price$"));
            RouteMapping escaped = mapping("^/api/(price)", "billing", new RouteTransformation(false, "/$1/$$"));

            assertThat(resolver.transform("/api/price", trailing)).isEqualTo("/price$");
            assertThat(resolver.transform("/api/price", escaped)).isEqualTo("/price/$");
        }

        @Test
        @DisplayName("two-digit references fall back to one digit when the group does not exist")
        void twoDigitReference() {
            RouteMapping m = mapping("^/api/(\\w+)", "core", new RouteTransformation(false, "/$10"));

            assertThat(resolver.transform("/api/users", m)).isEqualTo("/users0");
        }

        @Test
        @DisplayName("an optional group that did not take part expands to nothing")
        void unmatchedOptionalGroupIsEmpty() {
            RouteMapping m = mapping("^/api/(v1/)?(\\w+)", "core", new RouteTransformation(false, "/$1$2"));

            assertThat(resolver.transform("/api/users", m)).isEqualTo("/users");
        }

        @Test
        @DisplayName("capture group rewrite only replaces the matched part")
        void captureGroupRewriteKeepsUnmatchedTail() {
            RouteMapping m = mapping("^/api/v1/(\\w+)", "core", new RouteTransformation(false, "/$1"));

            assertThat(resolver.transform("/api/v1/users/42?x=1", m)).isEqualTo("/users/42?x=1");
        }

        @Test
        @DisplayName("rewrite that no longer matches returns the path unchanged")
        void rewriteWithoutMatchKeepsPath() {
            RouteMapping m = mapping("^/api/auth/", "auth", new RouteTransformation(false, "/auth"));

            assertThat(resolver.transform("/api/users", m)).isEqualTo("/api/users");
        }

        @Test
        @DisplayName("stripPrefix removes the matched prefix and keeps a leading slash")
        void stripPrefix() {
            RouteMapping m = mapping("^/api/users", "rbac-core", new RouteTransformation(true, null));

            assertThat(resolver.transform("/api/users", m)).isEqualTo("/");
            assertThat(resolver.transform("/api/users/123", m)).isEqualTo("/123");
            assertThat(resolver.transform("/api/users/profile", m)).isEqualTo("/profile");
        }

        @Test
        @DisplayName("stripPrefix adds a slash when the remainder lacks one")
        void stripPrefixNormalizesSlash() {
            RouteMapping m = mapping("^/api/users/", "rbac-core", new RouteTransformation(true, null));

            assertThat(resolver.transform("/api/users/123", m)).isEqualTo("/123");
            assertThat(resolver.transform("/api/users/", m)).isEqualTo("/");
        }

        @ParameterizedTest
        @ValueSource(strings = {"/api/users/123", "/api/users/a/b/c", "/api/users/?page=2"})
        @DisplayName("stripped path prefixed with the matched segment gives back the original")
        void stripPrefixRoundTrip(String path) {
            Pattern pattern = Pattern.compile("^/api/users");
            RouteMapping m = RouteMapping.of(pattern, "rbac-core", new RouteTransformation(true, null));

            String stripped = resolver.transform(path, m);
            var matcher = pattern.matcher(path);
            assertThat(matcher.find()).isTrue();

            assertThat(matcher.group() + stripped).isEqualTo(path);
        }

        @Test
        @DisplayName("rewrite takes precedence over stripPrefix")
        void rewriteWinsOverStripPrefix() {
            RouteMapping m = mapping("^/api/users", "rbac-core", new RouteTransformation(true, "/people"));

            assertThat(resolver.transform("/api/users/1", m)).isEqualTo("/people");
        }

        @Test
        void noTransformationKeepsPath() {
            assertThat(resolver.transform("/api/audit/logs", mapping("^/api/audit", "audit", null)))
                    .isEqualTo("/api/audit/logs");
            assertThat(resolver.transform("/api/audit/logs",
                    mapping("^/api/audit", "audit", new RouteTransformation(false, ""))))
                    .isEqualTo("/api/audit/logs");
        }
    }
}
