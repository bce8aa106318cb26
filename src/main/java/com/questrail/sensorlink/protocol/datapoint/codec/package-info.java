/**
 * DataPoint Codec: Wire-Level Framing
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the vendor
 * DataPoint protocol carried in the private channel. A batch is a
 * concatenation of frames:</p>
 *
 * <pre>
 *   +--------+--------+----------------+---------------------+
 *   | id (1) | type(1)| length (2, BE) | payload (length)    |
 *   +--------+--------+----------------+---------------------+
 * </pre>
 *
 * <p>Type codes: raw {@code 0x00}, boolean {@code 0x01}, integer32
 * {@code 0x02}, string {@code 0x03}, enumerated {@code 0x04}, bitmap
 * {@code 0x05}. A zero length is legal.</p>
 *
 * <h2>Wrapper Encodings</h2>
 * <p>Hosts hand over the same bytes in several shapes depending on firmware
 * and integration layer. Textual inputs are tried in a fixed order:</p>
 *
 * <ol>
 *   <li>base64, accepted only if it decodes strictly and starts with a
 *       complete, plausible frame</li>
 *   <li>JSON array of byte values, or object with a {@code data} array</li>
 *   <li>hexadecimal, with the same plausibility check as base64</li>
 *   <li>UTF-8 bytes of the text, unconditionally</li>
 * </ol>
 *
 * <h2>Architectural Placement</h2>
 *
 * <pre>
 *   private-channel payload
 *        → DataPointFrameDecoder   (unwrap + framing)
 *            → DataPointRecord     (id, type tag, undecoded payload)
 *                → DataPointValueDecoder
 *                    → DecodedValue → normalization
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>{@code DataPointRecord} is post-framing; payloads are not yet checked
 *       against their type tag.</li>
 *   <li>Truncation ends a batch; an unknown type code skips one frame.
 *       Neither is raised to the caller.</li>
 * </ul>
 */
package com.questrail.sensorlink.protocol.datapoint.codec;
