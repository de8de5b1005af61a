package com.example.preload.loadgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.List;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class ScrollWindowTest {

    @Test
    void visibleRowsAreContiguous() {
        ScrollWindow window = new ScrollWindow(100, 4, 1.1);

        assertThat(window.visibleFrom(10)).containsExactly("task-10", "task-11", "task-12", "task-13");
        assertThat(window.visibleFrom(96)).containsExactly("task-96", "task-97", "task-98", "task-99");
    }

    @RepeatedTest(5)
    void sampledWindowStaysInsideList() {
        ScrollWindow window = new ScrollWindow(20, 5, 1.0, new Well19937c(42L));

        for (int i = 0; i < 200; i++) {
            List<String> visible = window.nextVisible();
            assertThat(visible).hasSize(5);
            int top = Integer.parseInt(visible.get(0).substring("task-".length()));
            assertThat(top).isBetween(0, 15);
        }
    }

    @Test
    void rejectsImpossibleWindows() {
        assertThatIllegalArgumentException().isThrownBy(() -> new ScrollWindow(3, 4, 1.0));
        assertThatIllegalArgumentException().isThrownBy(() -> new ScrollWindow(3, 0, 1.0));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new ScrollWindow(10, 2, 1.0).visibleFrom(9));
    }
}
