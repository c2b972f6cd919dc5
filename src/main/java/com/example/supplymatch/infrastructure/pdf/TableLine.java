package com.example.supplymatch.infrastructure.pdf;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One visual line of a PDF page: the tokens sharing a baseline, ordered left to right.
 * {@code y} grows downwards from the top of the page.
 */
public final class TableLine {

    private final float y;
    private final List<PositionedToken> tokens = new ArrayList<>();
    private boolean sorted = false;

    public TableLine(float y) {
        this.y = y;
    }

    public void addToken(PositionedToken token) {
        if (token == null || token.text().isBlank()) {
            return;
        }
        tokens.add(token);
        sorted = false;
    }

    public List<PositionedToken> tokens() {
        if (!sorted) {
            tokens.sort(Comparator.comparing(PositionedToken::x));
            sorted = true;
        }
        return tokens;
    }

    public float y() {
        return y;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public String text() {
        return tokens().stream()
                .map(PositionedToken::text)
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return y + ": " + text();
    }
}
