package com.questrail.fits;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds synthetic FITS files in memory for tests.
 *
 * <p>Cards are padded to 80 characters, the header is terminated with
 * {@code END} and blank-padded to a 2880-byte boundary, and the payload is
 * zero-padded unless {@link Builder#withoutDataPadding()} is used.</p>
 */
public final class FitsTestFiles
{
    public static final int BLOCK = 2880;
    public static final int CARD = 80;

    private FitsTestFiles() {}

    /** Fixed-format valued card with the value right-justified to column 30. */
    public static String card(String keyword, Object value) {
        return pad(String.format("%-8s= %20s", keyword, value));
    }

    public static String card(String keyword, Object value, String comment) {
        return pad(String.format("%-8s= %20s / %s", keyword, value, comment));
    }

    /** Quoted string card. */
    public static String stringCard(String keyword, String text) {
        return pad(String.format("%-8s= '%-8s'", keyword, text.replace("'", "''")));
    }

    /** Any text, padded or truncated to 80 columns. */
    public static String raw(String text) {
        return pad(text);
    }

    public static String pad(String text) {
        if (text.length() >= CARD) {
            return text.substring(0, CARD);
        }
        final char[] out = new char[CARD];
        Arrays.fill(out, ' ');
        text.getChars(0, text.length(), out, 0);
        return new String(out);
    }

    /** Header bytes: the cards, END, blank padding to a block boundary. */
    public static byte[] header(List<String> cards) {
        final StringBuilder sb = new StringBuilder();
        for (String c : cards) {
            sb.append(pad(c));
        }
        sb.append(pad("END"));
        while (sb.length() % BLOCK != 0) {
            sb.append(' ');
        }
        return sb.toString().getBytes(StandardCharsets.US_ASCII);
    }

    public static byte[] header(String... cards) {
        return header(Arrays.asList(cards));
    }

    public static byte[] uint8(int... values) {
        final byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    public static byte[] int16(int... values) {
        final ByteBuffer b = ByteBuffer.allocate(values.length * 2).order(ByteOrder.BIG_ENDIAN);
        for (int v : values) {
            b.putShort((short) v);
        }
        return b.array();
    }

    public static byte[] int32(int... values) {
        final ByteBuffer b = ByteBuffer.allocate(values.length * 4).order(ByteOrder.BIG_ENDIAN);
        for (int v : values) {
            b.putInt(v);
        }
        return b.array();
    }

    public static byte[] float32(float... values) {
        final ByteBuffer b = ByteBuffer.allocate(values.length * 4).order(ByteOrder.BIG_ENDIAN);
        for (float v : values) {
            b.putFloat(v);
        }
        return b.array();
    }

    public static byte[] float64(double... values) {
        final ByteBuffer b = ByteBuffer.allocate(values.length * 8).order(ByteOrder.BIG_ENDIAN);
        for (double v : values) {
            b.putDouble(v);
        }
        return b.array();
    }

    /** Native-order view, for reading scaled output. */
    public static ByteBuffer nativeView(byte[] data) {
        return ByteBuffer.wrap(data).order(ByteOrder.nativeOrder());
    }

    public static Builder image(int bitpix, int... axes) {
        return new Builder(bitpix, axes);
    }

    public static final class Builder {
        private final List<String> cards = new ArrayList<>();
        private byte[] payload = new byte[0];
        private boolean padData = true;

        private Builder(int bitpix, int... axes) {
            cards.add(card("SIMPLE", "T"));
            cards.add(card("BITPIX", bitpix));
            cards.add(card("NAXIS", axes.length));
            for (int i = 0; i < axes.length; i++) {
                cards.add(card("NAXIS" + (i + 1), axes[i]));
            }
        }

        public Builder with(String keyword, Object value) {
            cards.add(card(keyword, value));
            return this;
        }

        public Builder withString(String keyword, String text) {
            cards.add(stringCard(keyword, text));
            return this;
        }

        public Builder withCard(String card) {
            cards.add(card);
            return this;
        }

        public Builder withPayload(byte[] bigEndian) {
            this.payload = bigEndian;
            return this;
        }

        public Builder withoutDataPadding() {
            this.padData = false;
            return this;
        }

        public byte[] build() {
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.writeBytes(header(cards));
            out.writeBytes(payload);
            if (padData) {
                final int rem = payload.length % BLOCK;
                if (rem != 0) {
                    out.writeBytes(new byte[BLOCK - rem]);
                }
            }
            return out.toByteArray();
        }
    }
}
