package ai.repocontext.analyzer.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class HistoryOrderTest {

    @Test
    void parsesKnownNames() {
        assertThat(HistoryOrder.from("results-first")).isEqualTo(HistoryOrder.RESULTS_FIRST);
        assertThat(HistoryOrder.from("ASSISTANT_FIRST")).isEqualTo(HistoryOrder.ASSISTANT_FIRST);
        assertThat(HistoryOrder.from(" ")).isEqualTo(HistoryOrder.RESULTS_FIRST);
    }

    @Test
    void rejectsUnknownNames() {
        assertThat(catchThrowable(() -> HistoryOrder.from("random"))).isInstanceOf(IllegalArgumentException.class);
    }
}
