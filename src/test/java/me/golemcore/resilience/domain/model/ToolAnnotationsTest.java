package me.golemcore.resilience.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolAnnotationsTest {

    @Test
    void defaultsDeclareNothing() {
        ToolAnnotations annotations = ToolAnnotations.defaults();

        assertFalse(annotations.isReadOnly());
        assertFalse(annotations.isDestructive());
        assertFalse(annotations.isIdempotent());
        assertFalse(annotations.isCacheable());
        assertFalse(annotations.isRequiresApproval());
        assertEquals(RiskLevel.LOW, annotations.getRiskLevel());
        assertTrue(annotations.getTags().isEmpty());
    }

    @Test
    void readOnlyPresetIsRetryableAndCacheable() {
        ToolAnnotations annotations = ToolAnnotations.readOnlyPreset();

        assertTrue(annotations.canRetry());
        assertTrue(annotations.canCache());
        assertFalse(annotations.shouldRequireApproval());
        assertEquals(RiskLevel.NONE, annotations.getRiskLevel());
    }

    @Test
    void destructivePresetRequiresApprovalAndNeverRetries() {
        ToolAnnotations annotations = ToolAnnotations.destructivePreset();

        assertFalse(annotations.canRetry());
        assertTrue(annotations.shouldRequireApproval());
        assertEquals(RiskLevel.HIGH, annotations.getRiskLevel());
    }

    @Test
    void readOnlyAloneDoesNotAllowRetry() {
        ToolAnnotations annotations = ToolAnnotations.builder().readOnly(true).build();

        assertFalse(annotations.canRetry());
    }

    @ParameterizedTest
    @CsvSource({
            "false,false,false,false",
            "true,false,false,false",
            "true,true,false,true",
            "true,false,true,true",
            "false,true,true,false" })
    void canCacheNeedsCacheableAndSafeSemantics(boolean cacheable, boolean readOnly, boolean idempotent,
            boolean expected) {
        ToolAnnotations annotations = ToolAnnotations.builder()
                .cacheable(cacheable)
                .readOnly(readOnly)
                .idempotent(idempotent)
                .build();

        assertEquals(expected, annotations.canCache());
    }

    @ParameterizedTest
    @CsvSource({ "NONE,false", "LOW,false", "MEDIUM,false", "HIGH,true", "CRITICAL,true" })
    void approvalFollowsRiskLevel(RiskLevel level, boolean expected) {
        ToolAnnotations annotations = ToolAnnotations.builder().riskLevel(level).build();

        assertEquals(expected, annotations.shouldRequireApproval());
    }

    @Test
    void tagsAreCollected() {
        ToolAnnotations annotations = ToolAnnotations.builder()
                .tag("network")
                .tag("search")
                .build();

        assertEquals(List.of("network", "search"), annotations.getTags());
    }

    @Test
    void riskLevelsAreOrdered() {
        assertTrue(RiskLevel.CRITICAL.isAtLeast(RiskLevel.HIGH));
        assertTrue(RiskLevel.MEDIUM.isAtLeast(RiskLevel.MEDIUM));
        assertFalse(RiskLevel.NONE.isAtLeast(RiskLevel.LOW));
        assertEquals("critical", RiskLevel.CRITICAL.label());
    }
}
