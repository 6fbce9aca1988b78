package com.spellcheck.service;

/**
 * Represents a single correction candidate.
 * Stores the text, its dictionary frequency (0 for split pairs) and the computed score.
 */
public class Suggestion {

    private final String text;
    private final long frequency;
    private final double score;

    public Suggestion(String text, long frequency, double score) {
        this.text = text;
        this.frequency = frequency;
        this.score = score;
    }

    public String getText() {
        return text;
    }

    public long getFrequency() {
        return frequency;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "Suggestion{" +
                "text='" + text + '\'' +
                ", frequency=" + frequency +
                ", score=" + score +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Suggestion)) return false;
        Suggestion that = (Suggestion) o;
        return text != null && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text == null ? 0 : text.hashCode();
    }
}
