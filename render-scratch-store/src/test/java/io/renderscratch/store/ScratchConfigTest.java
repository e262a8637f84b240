package io.renderscratch.store;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScratchConfigTest {

    @Test
    void defaultsAreUnfairWithDefaultCapacity() {
        ScratchConfig config = ScratchConfig.defaults();
        assertThat(config.fairLocking()).isFalse();
        assertThat(config.initialCapacity()).isEqualTo(16);
    }

    @Test
    void readsProperties() {
        Properties props = new Properties();
        props.setProperty(ScratchConfig.P_FAIR_LOCKING, " TRUE ");
        props.setProperty(ScratchConfig.P_INITIAL_CAPACITY, "64");

        ScratchConfig config = ScratchConfig.fromProperties(props);

        assertThat(config.fairLocking()).isTrue();
        assertThat(config.initialCapacity()).isEqualTo(64);
    }

    @Test
    void missingPropertiesKeepDefaults() {
        ScratchConfig config = ScratchConfig.fromProperties(new Properties());
        assertThat(config.fairLocking()).isFalse();
        assertThat(config.initialCapacity()).isEqualTo(16);
    }

    @Test
    void rejectsInvalidProperties() {
        Properties badBool = new Properties();
        badBool.setProperty(ScratchConfig.P_FAIR_LOCKING, "yes");
        assertThatThrownBy(() -> ScratchConfig.fromProperties(badBool)).isInstanceOf(IllegalArgumentException.class);

        Properties badInt = new Properties();
        badInt.setProperty(ScratchConfig.P_INITIAL_CAPACITY, "lots");
        assertThatThrownBy(() -> ScratchConfig.fromProperties(badInt))
                .isInstanceOf(IllegalArgumentException.class)
                .hasCauseInstanceOf(NumberFormatException.class);

        assertThatThrownBy(() -> new ScratchConfig(false, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOversizedInitialCapacity() {
        assertThat(new ScratchConfig(false, ScratchConfig.MAX_INITIAL_CAPACITY).initialCapacity())
                .isEqualTo(ScratchConfig.MAX_INITIAL_CAPACITY);
        assertThatThrownBy(() -> new ScratchConfig(false, ScratchConfig.MAX_INITIAL_CAPACITY + 1))
                .isInstanceOf(IllegalArgumentException.class);

        Properties props = new Properties();
        props.setProperty(ScratchConfig.P_INITIAL_CAPACITY, "2147483647");
        assertThatThrownBy(() -> ScratchConfig.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("initialCapacity");
    }

    @Test
    void fairStoreBehavesLikeDefaultStore() {
        Scratch scratch = new Scratch(new ScratchConfig(true, 0));
        scratch.add("n", 1);
        scratch.add("n", 2);
        assertThat(scratch.get("n")).hasValueSatisfying(v -> assertThat(v.toJava()).isEqualTo(3L));
    }
}
