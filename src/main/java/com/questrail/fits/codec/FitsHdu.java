package com.questrail.fits.codec;

import com.questrail.fits.model.FitsHeader;
import com.questrail.fits.model.SampleType;

import java.util.List;
import java.util.Objects;

/**
 * FitsHdu
 * -----------------------------------------------------------------------------
 * Immutable, decoded header-data unit.
 *
 * <p>Represents one HDU after the header cards have been decoded and the data
 * unit has been cut out of the file. The payload is still in FITS big-endian
 * order and still unscaled.</p>
 *
 * <p>Immutability is enforced via defensive copying.</p>
 */
public final class FitsHdu
{
    private final FitsHeader header;
    private final SampleType sampleType;
    private final List<Integer> axisSizes;
    private final byte[] payload;
    private final int headerOffset;
    private final int dataOffset;
    private final int nextHduOffset;

    public FitsHdu(FitsHeader header,
                   SampleType sampleType,
                   List<Integer> axisSizes,
                   byte[] payload,
                   int headerOffset,
                   int dataOffset,
                   int nextHduOffset) {

        this.header = Objects.requireNonNull(header, "header");
        this.sampleType = Objects.requireNonNull(sampleType, "sampleType");
        this.axisSizes = List.copyOf(axisSizes);
        this.payload = (payload == null) ? new byte[0] : payload.clone();
        this.headerOffset = headerOffset;
        this.dataOffset = dataOffset;
        this.nextHduOffset = nextHduOffset;
    }

    public FitsHeader header() {
        return header;
    }

    public SampleType sampleType() {
        return sampleType;
    }

    public List<Integer> axisSizes() {
        return axisSizes;
    }

    /**
     * Returns a copy of the big-endian payload bytes, without padding.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    /**
     * Byte offset of the first header card.
     */
    public int headerOffset() {
        return headerOffset;
    }

    /**
     * Byte offset of the first payload byte (the block after {@code END}).
     */
    public int dataOffset() {
        return dataOffset;
    }

    /**
     * Byte offset just past this HDU's padded data unit, clamped to the file
     * length when trailing padding is missing.
     */
    public int nextHduOffset() {
        return nextHduOffset;
    }

    @Override
    public String toString() {
        return "FitsHdu[" +
                "type=" + sampleType +
                ", axes=" + axisSizes +
                ", payloadLength=" + payload.length +
                ", dataOffset=" + dataOffset +
                ']';
    }
}
