package com.example.preload.eviction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InsertionOrderEvictionStrategyTest {

    private InsertionOrderEvictionStrategy<String> strategy;

    @BeforeEach
    void setUp() {
        strategy = new InsertionOrderEvictionStrategy<>();
        strategy.onInsert("a");
        strategy.onInsert("b");
        strategy.onInsert("c");
    }

    @Test
    void victimsAreOldestFirst() {
        assertThat(strategy.selectVictims(2)).containsExactly("a", "b");
    }

    @Test
    void selectingDoesNotRemove() {
        strategy.selectVictims(2);

        assertThat(strategy.size()).isEqualTo(3);
        assertThat(strategy.selectVictims(1)).containsExactly("a");
    }

    @Test
    void removedKeysAreSkipped() {
        strategy.onRemove("a");

        assertThat(strategy.selectVictims(5)).containsExactly("b", "c");
    }

    @Test
    void reinsertAfterRemoveMovesKeyToBack() {
        strategy.onRemove("a");
        strategy.onInsert("a");

        assertThat(strategy.selectVictims(3)).containsExactly("b", "c", "a");
    }

    @Test
    void clearEmptiesOrder() {
        strategy.clear();

        assertThat(strategy.selectVictims(3)).isEmpty();
        assertThat(strategy.selectVictims(0)).isEmpty();
    }
}
