/**
 * PRT-7 Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete input (standard input, a capture file, a Netty TCP
 * connection to a serial bridge, or a test double) and the decoder loop.
 *
 * <ul>
 *   <li>{@link com.questrail.prt7.transport.LineSource}: pull port used by the decoder</li>
 *   <li>{@link com.questrail.prt7.transport.LineEndpoint}: push port implemented by
 *       asynchronous transports</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and line framing only</li>
 *   <li>Not classify or decode frames</li>
 *   <li>Not touch the rotor or the assembly buffer</li>
 * </ul>
 */
package com.questrail.prt7.transport;
