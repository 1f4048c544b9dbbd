package com.example.admission;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyTableTest {

    private final PolicyTable table = new PolicyTable(
            List.of(
                    new PolicyRule("/api/search", 100, 60),
                    new PolicyRule("/api/documents", 200, 120),
                    new PolicyRule("/api/documents/upload", 20, 60)
            ),
            new PolicyRule("*", 1000, 3600),
            List.of("/api/health", "/api/webhooks", "/"),
            0.5
    );

    @Test
    void authenticatedCallerGetsConfiguredLimit() {
        ResolvedPolicy p = table.resolve("/api/search/query", true);

        assertThat(p.patternKey()).isEqualTo("/api/search");
        assertThat(p.limit()).isEqualTo(100);
        assertThat(p.windowSeconds()).isEqualTo(60);
    }

    @Test
    void anonymousLimitIsFlooredButWindowUnchanged() {
        PolicyTable odd = new PolicyTable(
                List.of(new PolicyRule("/api/voice", 31, 60)),
                new PolicyRule("*", 1000, 3600), List.of(), 0.5);

        ResolvedPolicy p = odd.resolve("/api/voice/transcribe", false);

        assertThat(p.limit()).isEqualTo(15);
        assertThat(p.windowSeconds()).isEqualTo(60);
    }

    @Test
    void longestMatchingPrefixWins() {
        // "/api/documents" も一致するが、より具体的な方が採用される
        ResolvedPolicy p = table.resolve("/api/documents/upload/batch", true);

        assertThat(p.patternKey()).isEqualTo("/api/documents/upload");
        assertThat(p.limit()).isEqualTo(20);

        assertThat(table.resolve("/api/documents/42", true).limit()).isEqualTo(200);
    }

    @Test
    void unmatchedPathFallsBackToDefaultKeyedByApiSegment() {
        ResolvedPolicy p = table.resolve("/api/projects/7/tasks", false);

        assertThat(p.patternKey()).isEqualTo("/api/projects");
        assertThat(p.limit()).isEqualTo(500);
        assertThat(p.windowSeconds()).isEqualTo(3600);

        assertThat(table.resolve("/metrics", true).patternKey()).isEqualTo("/metrics");
    }

    @Test
    void overrideTakesPrecedenceWhenItMatches() {
        PolicyRule override = new PolicyRule("/api/search/expensive", 5, 30);

        ResolvedPolicy p = table.resolve("/api/search/expensive", true, override);
        // グローバルのカウンタと混ざらないよう別のキー
        assertThat(p.patternKey()).isEqualTo("route:/api/search/expensive");
        assertThat(p.limit()).isEqualTo(5);
        assertThat(p.windowSeconds()).isEqualTo(30);

        // 一致しないパスには効かない
        assertThat(table.resolve("/api/search/cheap", true, override).limit()).isEqualTo(100);
    }

    @Test
    void exemptMatchingIsPrefixBasedExceptForRoot() {
        assertThat(table.isExempt("/api/health")).isTrue();
        assertThat(table.isExempt("/api/health/deep")).isTrue();
        assertThat(table.isExempt("/api/webhooks/stripe")).isTrue();
        assertThat(table.isExempt("/")).isTrue();

        assertThat(table.isExempt("/api/search")).isFalse();
        assertThat(table.isExempt("/anything")).isFalse();
    }

    @Test
    void maxWindowCoversDefaultAndRules() {
        assertThat(table.maxWindowSeconds()).isEqualTo(3600);

        PolicyTable shortDefault = new PolicyTable(
                List.of(new PolicyRule("/api/a", 1, 7200)),
                new PolicyRule("*", 1, 60), List.of(), 1.0);
        assertThat(shortDefault.maxWindowSeconds()).isEqualTo(7200);
    }

    @Test
    void invalidConfigurationIsRejectedAtConstruction() {
        assertThatThrownBy(() -> new PolicyTable(List.of(), null, List.of(), 0.5))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new PolicyTable(List.of(), new PolicyRule("*", 1, 1), List.of(), 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PolicyRule("/api/x", 0, 60))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PolicyRule("/api/x", 10, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void propertiesBuildTableWithShippedDefaults() {
        PolicyTable fromProps = new RateLimitProperties().toPolicyTable();

        assertThat(fromProps.rules()).hasSize(6);
        assertThat(fromProps.resolve("/api/ingestion/run", true).limit()).isEqualTo(50);
        assertThat(fromProps.resolve("/api/other", false).limit()).isEqualTo(500);
        assertThat(fromProps.isExempt("/api/crons/health")).isTrue();
    }

    @Test
    void propertiesWithoutDefaultRuleFailFast() {
        RateLimitProperties props = new RateLimitProperties();
        props.setDefaultRule(null);

        assertThatThrownBy(props::toPolicyTable).isInstanceOf(IllegalStateException.class);
    }
}
