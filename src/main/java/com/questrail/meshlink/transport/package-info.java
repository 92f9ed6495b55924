/**
 * MeshLink Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete radio transport (Android
 * BLE, a TCP bridge, a simulator, a test double) and the link core.</p>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no frame interpretation)</li>
 *   <li>Not retry, schedule timeouts or reconnect on their own</li>
 *   <li>Complete each returned stage exactly once</li>
 * </ul>
 *
 * <p>Queueing, retries, escalation and recovery live in the link core.</p>
 */
package com.questrail.meshlink.transport;
