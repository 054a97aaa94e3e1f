package com.questrail.fits.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One decoded 80-character header card.
 *
 * <p>For valued cards {@code value} holds the value text with surrounding
 * quotes removed. For commentary cards (blank, {@code COMMENT},
 * {@code HISTORY}) it holds the card text from column 9 onward.</p>
 *
 * @param keyword upper-cased keyword; empty for blank cards
 * @param value   decoded value text, never null
 * @param comment inline comment following {@code /}, or null
 * @param index   0-based position of the card within the header
 */
public record HeaderRecord(String keyword, String value, String comment, int index)
{
    public static final String COMMENT = "COMMENT";
    public static final String HISTORY = "HISTORY";
    public static final String END = "END";

    public HeaderRecord {
        Objects.requireNonNull(keyword, "keyword");
        Objects.requireNonNull(value, "value");
    }

    public Optional<String> commentText() {
        return Optional.ofNullable(comment);
    }

    /**
     * Returns true for blank, COMMENT and HISTORY cards.
     */
    public boolean isCommentary() {
        return keyword.isEmpty() || COMMENT.equals(keyword) || HISTORY.equals(keyword);
    }
}
