package com.example.preload.loadgen;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Picks which slice of a task list is on screen. Scroll positions follow a Zipf distribution, so the
 * top of the list is visible far more often than the tail.
 */
public class ScrollWindow {

    private final int totalTasks;
    private final int visibleRows;
    private final ZipfDistribution positions;

    public ScrollWindow(int totalTasks, int visibleRows, double alpha) {
        this(totalTasks, visibleRows, alpha, new Well19937c());
    }

    public ScrollWindow(int totalTasks, int visibleRows, double alpha, RandomGenerator random) {
        if (visibleRows <= 0 || totalTasks < visibleRows) {
            throw new IllegalArgumentException(
                "need 0 < visibleRows <= totalTasks, got visibleRows=" + visibleRows + ", totalTasks=" + totalTasks);
        }
        this.totalTasks = totalTasks;
        this.visibleRows = visibleRows;
        // One position per possible top row.
        this.positions = new ZipfDistribution(random, totalTasks - visibleRows + 1, alpha);
    }

    /** Ids of the rows visible at the next sampled scroll position, top to bottom. */
    public List<String> nextVisible() {
        return visibleFrom(positions.sample() - 1);
    }

    List<String> visibleFrom(int topRow) {
        if (topRow < 0 || topRow + visibleRows > totalTasks) {
            throw new IllegalArgumentException("top row out of range: " + topRow);
        }
        List<String> ids = new ArrayList<>(visibleRows);
        for (int row = topRow; row < topRow + visibleRows; row++) {
            ids.add(taskId(row));
        }
        return ids;
    }

    static String taskId(int row) {
        return "task-" + row;
    }
}
