/**
 * helixd Transport Ports
 * =============================================================================
 *
 * <p>These interfaces define the framework-agnostic boundary between a
 * concrete local socket implementation and the request pipeline.</p>
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Complete request lines as {@code byte[]}</li>
 *   <li>Opaque connection identifiers</li>
 *   <li>Connection lifecycle notifications</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O and line framing only</li>
 *   <li>Not decode JSON or interpret commands</li>
 *   <li>Preserve per-connection request/response ordering</li>
 *   <li>Isolate failures to the connection they occur on</li>
 * </ul>
 */
package com.questrail.helixd.transport;
