/**
 * helixd Codec
 * =============================================================================
 *
 * <p>The codec layer implements the wire rules of the helixd protocol:</p>
 *
 * <ul>
 *   <li>Line framing: one UTF-8 JSON object per {@code \n}-terminated line</li>
 *   <li>Size limit: lines over {@code MAX_MESSAGE_SIZE} are rejected unparsed</li>
 *   <li>Version gate: the envelope version must equal {@code PROTOCOL_VERSION}</li>
 *   <li>Structural decoding of the envelope and its tagged command</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] line
 *        → RequestDecoder     (size, version, structure)
 *            → Request
 *                → CommandDispatcher
 *                    → Response
 *                        → ResponseEncoder
 *                            → byte[] line
 * </pre>
 *
 * <p>No I/O happens here. Transport adapters hand complete lines in and write
 * encoded lines out.</p>
 */
package com.questrail.helixd.protocol.codec;
