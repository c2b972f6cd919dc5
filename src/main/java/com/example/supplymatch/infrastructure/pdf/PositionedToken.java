package com.example.supplymatch.infrastructure.pdf;

/**
 * Word extracted from the PDF with its horizontal extent.
 */
public final class PositionedToken {

    private final float x;
    private final float endX;
    private final String text;

    public PositionedToken(float x, float endX, String text) {
        this.x = x;
        this.endX = Math.max(endX, x);
        this.text = text == null ? "" : text;
    }

    public float x() {
        return x;
    }

    public float endX() {
        return endX;
    }

    public float center() {
        return x + ((endX - x) / 2f);
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text + "@" + x;
    }
}
