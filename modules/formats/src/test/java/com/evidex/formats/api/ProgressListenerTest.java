package com.evidex.formats.api;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressListenerTest {

    @Test
    void scaledListenerMapsOntoSubRange() {
        List<Integer> values = new ArrayList<>();
        ProgressListener target = (current, total, message) -> {
            assertThat(total).isEqualTo(100);
            values.add(current);
        };

        ProgressListener scaled = ProgressListener.scaled(target, 30, 60);
        scaled.onProgress(0, 4, "a");
        scaled.onProgress(2, 4, "b");
        scaled.onProgress(4, 4, "c");

        assertThat(values).containsExactly(30, 60, 90);
    }

    @Test
    void unknownTotalStaysAtRangeStart() {
        List<Integer> values = new ArrayList<>();
        ProgressListener scaled = ProgressListener.scaled((c, t, m) -> values.add(c), 10, 20);

        scaled.onProgress(17, 0, "Indexing: x");

        assertThat(values).containsExactly(10);
    }

    @Test
    void nullListenerBecomesNoOp() {
        assertThat(ProgressListener.orNone(null)).isSameAs(ProgressListener.NONE);
        assertThat(ProgressListener.scaled(null, 0, 100)).isSameAs(ProgressListener.NONE);
    }
}
