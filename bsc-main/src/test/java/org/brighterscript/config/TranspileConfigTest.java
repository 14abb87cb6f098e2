package org.brighterscript.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranspileConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(TranspileConfig.INDENT_PROPERTY);
        System.clearProperty(TranspileConfig.SOURCE_MAPS_PROPERTY);
        System.clearProperty(TranspileConfig.MAX_INHERITANCE_DEPTH_PROPERTY);
    }

    @Test
    void defaults() {
        TranspileConfig config = TranspileConfig.defaults();

        assertThat(config.getIndent()).isEqualTo("    ");
        assertThat(config.isSourceMaps()).isTrue();
        assertThat(config.getMaxInheritanceDepth()).isEqualTo(64);
    }

    @Test
    void withMethods_returnNewInstances() {
        TranspileConfig defaults = TranspileConfig.defaults();
        TranspileConfig custom = defaults.withIndent("\t").withSourceMaps(false).withMaxInheritanceDepth(3);

        assertThat(custom.getIndent()).isEqualTo("\t");
        assertThat(custom.isSourceMaps()).isFalse();
        assertThat(custom.getMaxInheritanceDepth()).isEqualTo(3);
        assertThat(defaults.getIndent()).isEqualTo("    ");
    }

    @Test
    void systemProperties_overrideDefaults() {
        System.setProperty(TranspileConfig.INDENT_PROPERTY, "  ");
        System.setProperty(TranspileConfig.SOURCE_MAPS_PROPERTY, "false");
        System.setProperty(TranspileConfig.MAX_INHERITANCE_DEPTH_PROPERTY, " 8 ");

        TranspileConfig config = TranspileConfig.fromSystemProperties();

        assertThat(config.getIndent()).isEqualTo("  ");
        assertThat(config.isSourceMaps()).isFalse();
        assertThat(config.getMaxInheritanceDepth()).isEqualTo(8);
    }

    @Test
    void invalidDepthProperty_isRejected() {
        System.setProperty(TranspileConfig.MAX_INHERITANCE_DEPTH_PROPERTY, "deep");

        assertThatThrownBy(TranspileConfig::fromSystemProperties)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deep")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void nonPositiveDepth_isRejected() {
        assertThatThrownBy(() -> TranspileConfig.defaults().withMaxInheritanceDepth(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
