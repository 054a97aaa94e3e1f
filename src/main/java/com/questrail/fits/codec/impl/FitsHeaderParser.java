package com.questrail.fits.codec.impl;

import com.questrail.fits.error.MalformedHeaderException;
import com.questrail.fits.model.DuplicateKeywordPolicy;
import com.questrail.fits.model.FitsHeader;
import com.questrail.fits.model.HeaderRecord;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * FitsHeaderParser
 * -----------------------------------------------------------------------------
 * Decodes a sequence of 2880-byte header blocks into a {@link FitsHeader}.
 *
 * <p>Card rules (FITS 4.0 section 4.1):</p>
 * <ul>
 *   <li>Columns 1-8 hold the keyword, left-justified and blank-padded.</li>
 *   <li>Blank, {@code COMMENT} and {@code HISTORY} cards are commentary; their
 *       text from column 9 is kept verbatim (right-trimmed).</li>
 *   <li>A valued card has {@code =} as its value indicator, normally in column
 *       9. The value runs to the first {@code /} that is not inside a quoted
 *       string; the rest is the comment.</li>
 *   <li>String values are enclosed in single quotes; an embedded quote is
 *       written twice. Trailing blanks inside the quotes are not significant.</li>
 *   <li>Only printable ASCII (0x20-0x7E) is permitted.</li>
 * </ul>
 *
 * <p>Decoding stops at the {@code END} card. The reported data offset is the
 * start of the block following the one that holds {@code END}, wherever in
 * that block the card sits.</p>
 */
final class FitsHeaderParser
{
    /**
     * Outcome of a header parse: the header and the offset of the first
     * byte after its final block.
     */
    record Result(FitsHeader header, int dataOffset, int cardCount) {}

    private final DuplicateKeywordPolicy duplicatePolicy;

    FitsHeaderParser(DuplicateKeywordPolicy duplicatePolicy)
    {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    }

    /**
     * Parses header blocks starting at {@code offset}.
     *
     * @throws MalformedHeaderException if {@code END} is not found before the
     *         buffer ends, or a card contains a non-printable byte or an
     *         unterminated string
     */
    Result parse(byte[] data, int offset)
            throws MalformedHeaderException
    {
        Objects.requireNonNull(data, "data");
        if (offset < 0 || offset > data.length) {
            throw new MalformedHeaderException("header offset " + offset + " outside buffer of " + data.length + " bytes");
        }

        final List<HeaderRecord> records = new ArrayList<>();
        int blockStart = offset;
        int cardIndex = 0;

        while (blockStart < data.length) {
            final int blockEnd = Math.min(blockStart + FitsBlocks.BLOCK_SIZE, data.length);

            for (int cardStart = blockStart; cardStart + FitsBlocks.CARD_SIZE <= blockEnd; cardStart += FitsBlocks.CARD_SIZE) {
                final String card = decodeCard(data, cardStart, cardIndex);
                final HeaderRecord record = parseCard(card, cardIndex);

                if (HeaderRecord.END.equals(record.keyword())) {
                    final int dataOffset = (int) Math.min(
                            (long) blockStart + FitsBlocks.BLOCK_SIZE, data.length);
                    return new Result(new FitsHeader(records, duplicatePolicy), dataOffset, cardIndex + 1);
                }

                records.add(record);
                cardIndex++;
            }

            blockStart += FitsBlocks.BLOCK_SIZE;
        }

        throw new MalformedHeaderException("END keyword not found");
    }

    private static String decodeCard(byte[] data, int start, int cardIndex)
            throws MalformedHeaderException
    {
        for (int i = start; i < start + FitsBlocks.CARD_SIZE; i++) {
            final int b = data[i] & 0xFF;
            if (b < 0x20 || b > 0x7E) {
                throw new MalformedHeaderException(String.format(
                        "non-printable byte 0x%02X in card %d, column %d",
                        b, cardIndex + 1, i - start + 1));
            }
        }
        return new String(data, start, FitsBlocks.CARD_SIZE, StandardCharsets.US_ASCII);
    }

    /**
     * Parses one 80-character card. Exposed for unit tests.
     */
    static HeaderRecord parseCard(String card, int index)
            throws MalformedHeaderException
    {
        final String keywordField = card.substring(0, Math.min(FitsBlocks.KEYWORD_WIDTH, card.length()));
        final String keyword = keywordField.trim().toUpperCase(Locale.ROOT);

        // Commentary cards keep their text verbatim.
        if (keyword.isEmpty() || HeaderRecord.COMMENT.equals(keyword) || HeaderRecord.HISTORY.equals(keyword)) {
            final String text = card.length() > FitsBlocks.KEYWORD_WIDTH
                    ? stripTrailing(card.substring(FitsBlocks.KEYWORD_WIDTH))
                    : "";
            return new HeaderRecord(keyword, text, null, index);
        }

        if (HeaderRecord.END.equals(keyword)) {
            return new HeaderRecord(HeaderRecord.END, "", null, index);
        }

        final int equals = card.indexOf('=');
        final boolean hierarch = keyword.startsWith("HIERARCH");
        if (equals < 0 || (equals > FitsBlocks.KEYWORD_WIDTH && !hierarch)) {
            // Keyword without value indicator (e.g. CONTINUE): keep the text.
            final String text = card.length() > FitsBlocks.KEYWORD_WIDTH
                    ? card.substring(FitsBlocks.KEYWORD_WIDTH).trim()
                    : "";
            return new HeaderRecord(keyword, text, null, index);
        }

        final String name = card.substring(0, equals).trim().toUpperCase(Locale.ROOT);
        return parseValue(name, card.substring(equals + 1), index);
    }

    private static HeaderRecord parseValue(String keyword, String field, int index)
            throws MalformedHeaderException
    {
        int i = 0;
        while (i < field.length() && field.charAt(i) == ' ') {
            i++;
        }

        if (i < field.length() && field.charAt(i) == '\'') {
            final StringBuilder value = new StringBuilder();
            int j = i + 1;
            boolean closed = false;
            while (j < field.length()) {
                final char c = field.charAt(j);
                if (c == '\'') {
                    if (j + 1 < field.length() && field.charAt(j + 1) == '\'') {
                        value.append('\'');
                        j += 2;
                        continue;
                    }
                    closed = true;
                    j++;
                    break;
                }
                value.append(c);
                j++;
            }
            if (!closed) {
                throw new MalformedHeaderException(
                        "unterminated string value for " + keyword + " in card " + (index + 1));
            }
            return new HeaderRecord(keyword, stripTrailing(value.toString()), commentAfter(field, j), index);
        }

        final int slash = field.indexOf('/', i);
        final String raw = (slash >= 0 ? field.substring(i, slash) : field.substring(i)).trim();
        final String comment = slash >= 0 ? field.substring(slash + 1).trim() : null;
        return new HeaderRecord(keyword, stripDoubleQuotes(raw), comment, index);
    }

    private static String commentAfter(String field, int from)
    {
        final int slash = field.indexOf('/', from);
        return slash >= 0 ? field.substring(slash + 1).trim() : null;
    }

    private static String stripDoubleQuotes(String value)
    {
        if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static String stripTrailing(String s)
    {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == ' ') {
            end--;
        }
        return s.substring(0, end);
    }
}
