/**
 * Hub Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete link to the hub (a BLE stack, the TCP bridge, a test
 * double) and the hub engine.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used for the bridge transport <strong>without</strong> allowing
 * Netty types to leak into the engine. Everything above the transport sees
 * only:
 * <ul>
 *   <li>Raw frames as {@code byte[]}</li>
 *   <li>Characteristic handles as {@code int}</li>
 *   <li>Link liveness</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no protocol interpretation)</li>
 *   <li>Not decode messages</li>
 *   <li>Deliver notifications serially and in order</li>
 * </ul>
 */
package com.questrail.brickhub.transport;
