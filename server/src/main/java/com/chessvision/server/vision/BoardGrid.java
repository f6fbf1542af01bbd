package com.chessvision.server.vision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable 8x8 grid addressed as (row, col), row 0 being the top edge of the image as captured.
 */
public final class BoardGrid<T> {
    public static final int SIZE = 8;

    private final List<List<T>> cells;

    private BoardGrid(List<List<T>> cells) {
        this.cells = cells;
    }

    public static <T> BoardGrid<T> of(List<List<T>> rows) {
        if (rows == null || rows.size() != SIZE) {
            throw new IllegalArgumentException("Board grid must have " + SIZE + " rows");
        }
        List<List<T>> copy = new ArrayList<>(SIZE);
        for (List<T> row : rows) {
            if (row == null || row.size() != SIZE) {
                throw new IllegalArgumentException("Each board row must have " + SIZE + " cells");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new BoardGrid<>(Collections.unmodifiableList(copy));
    }

    public interface CellFactory<T> {
        T create(int row, int col);
    }

    public static <T> BoardGrid<T> generate(CellFactory<T> factory) {
        List<List<T>> rows = new ArrayList<>(SIZE);
        for (int r = 0; r < SIZE; r++) {
            List<T> row = new ArrayList<>(SIZE);
            for (int c = 0; c < SIZE; c++) {
                row.add(factory.create(r, c));
            }
            rows.add(row);
        }
        return of(rows);
    }

    public T get(int row, int col) {
        return cells.get(row).get(col);
    }

    public List<T> row(int row) {
        return cells.get(row);
    }

    public <R> BoardGrid<R> map(Function<? super T, ? extends R> fn) {
        return generate((r, c) -> fn.apply(get(r, c)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoardGrid)) {
            return false;
        }
        return cells.equals(((BoardGrid<?>) o).cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells);
    }

    @Override
    public String toString() {
        return "BoardGrid" + cells;
    }
}
