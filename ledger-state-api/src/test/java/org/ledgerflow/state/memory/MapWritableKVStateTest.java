// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MapWritableKVStateTest {

    private Map<String, Long> backingStore;
    private MapWritableKVState<String, Long> subject;

    @BeforeEach
    void setUp() {
        backingStore = new LinkedHashMap<>();
        backingStore.put("a", 1L);
        backingStore.put("b", 2L);
        subject = new MapWritableKVState<>(7, "TEST", backingStore);
    }

    @Test
    @DisplayName("Puts are visible through the state but not in the backing store before commit")
    void putIsBuffered() {
        subject.put("c", 3L);
        subject.put("a", 10L);

        assertThat(subject.get("c")).isEqualTo(3L);
        assertThat(subject.get("a")).isEqualTo(10L);
        assertThat(backingStore).containsOnlyKeys("a", "b").containsEntry("a", 1L);
        assertThat(subject.modifiedKeys()).containsExactly("c", "a");
    }

    @Test
    @DisplayName("Commit flushes new and replaced values and clears the buffer")
    void commitFlushes() {
        subject.put("c", 3L);
        subject.put("b", 20L);

        subject.commit();

        assertThat(backingStore).containsOnlyKeys("a", "b", "c").containsEntry("b", 20L).containsEntry("c", 3L);
        assertThat(subject.modifiedKeys()).isEmpty();
    }

    @Test
    @DisplayName("Reset discards every buffered change")
    void resetDiscards() {
        subject.put("c", 3L);
        subject.put("a", 10L);

        subject.reset();

        assertThat(subject.get("a")).isEqualTo(1L);
        assertThat(subject.get("c")).isNull();
        assertThat(subject.modifiedKeys()).isEmpty();
        subject.commit();
        assertThat(backingStore).containsOnlyKeys("a", "b");
    }

    @Test
    @DisplayName("Keys and size include buffered changes in insertion order")
    void keysAndSizeMergeModifications() {
        subject.put("c", 3L);
        subject.put("b", 20L);

        final List<String> keys = new ArrayList<>();
        subject.keys().forEachRemaining(keys::add);

        assertThat(keys).containsExactly("a", "b", "c");
        assertThat(subject.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Replacing an existing value does not change the size")
    void replaceKeepsSize() {
        subject.put("a", 10L);

        assertThat(subject.size()).isEqualTo(2);
        assertThat(subject.contains("zzz")).isFalse();
    }

    @Test
    @DisplayName("Null keys and values are rejected")
    void rejectsNulls() {
        assertThatThrownBy(() -> subject.put(null, 1L)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> subject.put("a", null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> subject.get(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("State id and label are kept")
    void exposesIdAndLabel() {
        assertThat(subject.getStateId()).isEqualTo(7);
        assertThat(subject.getLabel()).isEqualTo("TEST");
    }
}
