package info.isaksson.erland.cxxtempl.templ;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Match priorities indexed by (candidate, parameter position); -1 means no match. */
final class PriorityMatrix {

    private final int[][] cells;
    private final int columns;

    PriorityMatrix(int candidates, int columns) {
        this.columns = columns;
        this.cells = new int[candidates][columns];
        for (int[] row : cells) Arrays.fill(row, -1);
    }

    void set(int candidate, int column, int priority) {
        cells[candidate][column] = priority;
    }

    int get(int candidate, int column) {
        return cells[candidate][column];
    }

    /** Every position of the candidate matched. */
    boolean qualifies(int candidate) {
        for (int c = 0; c < columns; c++) {
            if (cells[candidate][c] < 0) return false;
        }
        return true;
    }

    List<Integer> qualifying() {
        List<Integer> out = new ArrayList<>();
        for (int r = 0; r < cells.length; r++) {
            if (qualifies(r)) out.add(r);
        }
        return out;
    }

    /** Candidates of {@code pool} that reach the pool's best priority at every position. */
    List<Integer> bestOf(List<Integer> pool) {
        int[] max = new int[columns];
        Arrays.fill(max, -1);
        for (int r : pool) {
            for (int c = 0; c < columns; c++) max[c] = Math.max(max[c], cells[r][c]);
        }
        List<Integer> out = new ArrayList<>();
        for (int r : pool) {
            boolean best = true;
            for (int c = 0; c < columns && best; c++) best = cells[r][c] == max[c];
            if (best) out.add(r);
        }
        return out;
    }
}
