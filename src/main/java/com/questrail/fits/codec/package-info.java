/**
 * FITS Codec - Block-Level Decoding
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the library: the
 * boundary between a raw FITS byte buffer and a structured header-data unit
 * ({@link com.questrail.fits.codec.FitsHdu}). It implements the fixed-format
 * rules of the FITS standard (version 4.0, section 3 and 4):</p>
 *
 * <ul>
 *   <li>2880-byte logical blocks</li>
 *   <li>36 header cards of 80 ASCII characters per block</li>
 *   <li>{@code END} card termination, with the remainder of its block skipped</li>
 *   <li>data unit sizing from NAXIS, NAXISn and BITPIX</li>
 *   <li>data unit padding to the next block boundary</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] file
 *        → FitsHduDecoder          (block and card rules applied here)
 *            → FitsHdu             (header table + big-endian payload)
 *                → FitsMetadataBuilder
 *                    → ImageMetadata / WcsParameters
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec performs no file I/O; callers supply the complete buffer.</li>
 *   <li>Payload bytes are returned exactly as stored (big-endian). Byte-order
 *       conversion and BZERO/BSCALE scaling happen above this layer.</li>
 *   <li>Keyword semantics beyond what is needed to size the data unit are not
 *       interpreted here.</li>
 * </ul>
 */
package com.questrail.fits.codec;
