package io.fullerstack.ses.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HierarchicalConfig}.
 * <p>
 * Coverage:
 * - Global configuration (ses-monitor.properties)
 * - Environment-specific configuration (fallback to global)
 * - System property and environment variable overrides
 * - Type-safe getters and default handling
 * - Error handling (missing keys, invalid formats)
 */
class HierarchicalConfigTest {

    private static HierarchicalConfig isolated(HierarchicalConfig config) {
        return config.withEnvironment(name -> null);
    }

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("thresholds.sending-quota.critical-percent");
        System.clearProperty("notify.dry-run");
    }

    // =========================================================================
    // Global Configuration Tests
    // =========================================================================

    @Test
    void testGlobal_ReturnsGlobalConfig() {
        HierarchicalConfig config = HierarchicalConfig.global();

        assertThat(config.context()).isEqualTo("global");
    }

    @Test
    void testGlobal_ReadsQuotaThresholds() {
        HierarchicalConfig config = isolated(HierarchicalConfig.global());

        assertThat(config.getDouble("thresholds.sending-quota.warning-percent")).isEqualTo(80.0);
        assertThat(config.getDouble("thresholds.sending-quota.critical-percent")).isEqualTo(90.0);
    }

    @Test
    void testGlobal_BlankValueIsAbsent() {
        HierarchicalConfig config = isolated(HierarchicalConfig.global());

        assertThat(config.contains("slack.webhook-url")).isTrue();
        assertThat(config.getOptionalString("slack.webhook-url")).isEmpty();
        assertThat(config.getString("slack.webhook-url", "fallback")).isEqualTo("fallback");
    }

    // =========================================================================
    // Environment Configuration Tests
    // =========================================================================

    @Test
    void testEnvironment_OverridesGlobalValue() {
        HierarchicalConfig config = isolated(HierarchicalConfig.forEnvironment("test"));

        assertThat(config.context()).isEqualTo("environment:test");
        assertThat(config.getDouble("thresholds.sending-quota.critical-percent")).isEqualTo(85.0);
    }

    @Test
    void testEnvironment_FallsBackToGlobal() {
        HierarchicalConfig config = isolated(HierarchicalConfig.forEnvironment("test"));

        assertThat(config.getDouble("thresholds.sending-quota.warning-percent")).isEqualTo(80.0);
    }

    @Test
    void testEnvironment_UnknownEnvironmentUsesGlobal() {
        HierarchicalConfig config = isolated(HierarchicalConfig.forEnvironment("nowhere"));

        assertThat(config.getDouble("thresholds.sending-quota.critical-percent")).isEqualTo(90.0);
    }

    @Test
    void testEnvironment_RejectsBlankName() {
        assertThatThrownBy(() -> HierarchicalConfig.forEnvironment(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // =========================================================================
    // Override Tests
    // =========================================================================

    @Test
    void testSystemProperty_OverridesBundle() {
        System.setProperty("thresholds.sending-quota.critical-percent", "99");
        HierarchicalConfig config = isolated(HierarchicalConfig.forEnvironment("test"));

        assertThat(config.getDouble("thresholds.sending-quota.critical-percent")).isEqualTo(99.0);
    }

    @Test
    void testEnvironmentVariable_OverridesBundle() {
        Map<String, String> env = Map.of("THRESHOLDS_SENDING_QUOTA_CRITICAL_PERCENT", "70");
        HierarchicalConfig config = HierarchicalConfig.forEnvironment("test").withEnvironment(env::get);

        assertThat(config.getDouble("thresholds.sending-quota.critical-percent")).isEqualTo(70.0);
    }

    @Test
    void testSystemProperty_WinsOverEnvironmentVariable() {
        System.setProperty("notify.dry-run", "false");
        Map<String, String> env = Map.of("NOTIFY_DRY_RUN", "true");
        HierarchicalConfig config = HierarchicalConfig.global().withEnvironment(env::get);

        assertThat(config.getBoolean("notify.dry-run", true)).isFalse();
    }

    @Test
    void testEnvironmentVariableName() {
        assertThat(HierarchicalConfig.environmentVariableName("slack.webhook-url")).isEqualTo("SLACK_WEBHOOK_URL");
    }

    // =========================================================================
    // Typed Getter Tests
    // =========================================================================

    @Test
    void testGetList_SplitsAndTrims() {
        HierarchicalConfig config = isolated(HierarchicalConfig.forEnvironment("test"));

        assertThat(config.getList("slack.channels")).containsExactly("#ops", "#ses-alerts");
        assertThat(config.getList("no.such.key")).isEmpty();
    }

    @Test
    void testGetBoolean_AcceptsYes() {
        HierarchicalConfig config = isolated(HierarchicalConfig.forEnvironment("test"));

        assertThat(config.getBoolean("notify.slack.on-sending-quota", false)).isTrue();
    }

    @Test
    void testGetBoolean_RejectsGarbage() {
        HierarchicalConfig config = HierarchicalConfig.global()
            .withEnvironment(Map.of("NOTIFY_DRY_RUN", "maybe")::get);

        assertThatThrownBy(() -> config.getBoolean("notify.dry-run", false))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("notify.dry-run");
    }

    @Test
    void testGetDouble_RejectsGarbage() {
        HierarchicalConfig config = HierarchicalConfig.global()
            .withEnvironment(Map.of("THRESHOLDS_BOUNCE_RATE_WARNING_PERCENT", "five")::get);

        assertThatThrownBy(() -> config.getDouble("thresholds.bounce-rate.warning-percent", 5))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void testGetString_MissingKeyThrows() {
        HierarchicalConfig config = isolated(HierarchicalConfig.global());

        assertThatThrownBy(() -> config.getString("no.such.key"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("no.such.key")
            .hasMessageContaining("global");
    }

    @Test
    void testGetInt_DefaultWhenMissing() {
        HierarchicalConfig config = isolated(HierarchicalConfig.global());

        assertThat(config.getInt("no.such.key", 42)).isEqualTo(42);
    }
}
