package com.questrail.fits.internal.metadata;

import com.questrail.fits.model.FitsHeader;
import com.questrail.fits.wcs.CoordinateTypes;
import com.questrail.fits.wcs.TransformMatrix;
import com.questrail.fits.wcs.WcsParameters;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * WcsKeywordExtractor
 * -----------------------------------------------------------------------------
 * Reads the celestial WCS keyword family from a decoded header.
 *
 * <p>A WCS is produced only when CRPIX1, CRPIX2, CRVAL1 and CRVAL2 are all
 * present and numeric. Anything less yields {@link Optional#empty()}; an
 * incomplete WCS is never an error.</p>
 *
 * <p>Linear terms, in order of precedence:</p>
 * <ol>
 *   <li>{@code CDi_j}: any element present builds the matrix, absent
 *       elements are zero</li>
 *   <li>{@code PCi_j} scaled by {@code CDELTi}</li>
 *   <li>{@code CDELTi} with the optional {@code CROTA2} (or {@code CROTA1})</li>
 * </ol>
 */
public final class WcsKeywordExtractor
{
    private static final String[][] CD_KEYS = {
            {"CD1_1", "CD1_2"},
            {"CD2_1", "CD2_2"}
    };

    private static final String[][] PC_KEYS = {
            {"PC1_1", "PC1_2"},
            {"PC2_1", "PC2_2"}
    };

    private WcsKeywordExtractor() {}

    public static Optional<WcsParameters> extract(FitsHeader header) {
        final OptionalDouble crpix1 = header.doubleValue("CRPIX1");
        final OptionalDouble crpix2 = header.doubleValue("CRPIX2");
        final OptionalDouble crval1 = header.doubleValue("CRVAL1");
        final OptionalDouble crval2 = header.doubleValue("CRVAL2");

        if (crpix1.isEmpty() || crpix2.isEmpty() || crval1.isEmpty() || crval2.isEmpty()) {
            return Optional.empty();
        }

        final OptionalDouble cdelt1 = header.doubleValue("CDELT1");
        final OptionalDouble cdelt2 = header.doubleValue("CDELT2");
        final TransformMatrix cd = matrix(header, CD_KEYS, 0.0);

        final WcsParameters.Builder b = WcsParameters.builder()
                .withReferencePixel(crpix1.getAsDouble(), crpix2.getAsDouble())
                .withReferenceValue(crval1.getAsDouble(), crval2.getAsDouble());

        if (cd != null) {
            b.withCdMatrix(cd);
        } else {
            final TransformMatrix pc = matrix(header, PC_KEYS, 1.0);
            if (pc != null && cdelt1.isPresent() && cdelt2.isPresent()) {
                b.withCdMatrix(TransformMatrix.fromPc(
                        cdelt1.getAsDouble(), cdelt2.getAsDouble(),
                        pc.cd11(), pc.cd12(), pc.cd21(), pc.cd22()));
            }
        }

        if (cdelt1.isPresent() || cdelt2.isPresent()) {
            b.withPixelScale(cdelt1.orElse(0.0), cdelt2.orElse(0.0));
        } else if (cd != null) {
            b.withPixelScale(cd.cd11(), cd.cd22());
        }

        final OptionalDouble crota = first(header, "CROTA2", "CROTA1");
        if (crota.isPresent()) {
            b.withRotationAngle(crota.getAsDouble());
        }

        final String ctype1 = header.nonBlankValue("CTYPE1").orElse(CoordinateTypes.EQUATORIAL_DEFAULT.x());
        final String ctype2 = header.nonBlankValue("CTYPE2").orElse(CoordinateTypes.EQUATORIAL_DEFAULT.y());
        b.withCoordinateTypes(ctype1, ctype2);
        b.withProjection(projectionCode(ctype1));

        b.withCoordinateSystem(header.nonBlankValue("RADESYS")
                .or(() -> header.nonBlankValue("RADECSYS"))
                .orElse(null));

        final OptionalDouble equinox = first(header, "EQUINOX", "EPOCH");
        if (equinox.isPresent()) {
            b.withEquinox(equinox.getAsDouble());
        }

        return Optional.of(b.build());
    }

    /**
     * Extracts the projection code from a CTYPE value.
     *
     * <p>{@code RA---TAN} gives {@code TAN}; {@code RA---TAN-SIP} also gives
     * {@code TAN} (the distortion suffix is dropped). A value without the
     * 4+3 layout falls back to its last dash-separated component. Returns
     * {@code null} when no code can be found.</p>
     */
    static String projectionCode(String ctype) {
        if (ctype == null) {
            return null;
        }
        final String value = ctype.trim().toUpperCase(Locale.ROOT);

        if (value.length() > 5 && value.charAt(4) == '-') {
            final String tail = value.substring(5);
            final int dash = tail.indexOf('-');
            final String code = (dash >= 0 ? tail.substring(0, dash) : tail).trim();
            if (!code.isEmpty()) {
                return code;
            }
        }

        final int last = value.lastIndexOf('-');
        if (last >= 0 && last < value.length() - 1) {
            return value.substring(last + 1).trim();
        }
        return null;
    }

    /**
     * Reads a 2x2 keyword matrix, or {@code null} if none of its elements is
     * present. Missing off-diagonal elements are 0; missing diagonal elements
     * take {@code diagonalDefault} (0 for CD, 1 for PC).
     */
    private static TransformMatrix matrix(FitsHeader header, String[][] keys, double diagonalDefault) {
        boolean any = false;
        final double[] v = new double[4];
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                final OptionalDouble d = header.doubleValue(keys[i][j]);
                if (d.isPresent()) {
                    any = true;
                    v[i * 2 + j] = d.getAsDouble();
                } else {
                    v[i * 2 + j] = (i == j) ? diagonalDefault : 0.0;
                }
            }
        }
        return any ? new TransformMatrix(v[0], v[1], v[2], v[3]) : null;
    }

    private static OptionalDouble first(FitsHeader header, String primary, String fallback) {
        final OptionalDouble value = header.doubleValue(primary);
        return value.isPresent() ? value : header.doubleValue(fallback);
    }
}
