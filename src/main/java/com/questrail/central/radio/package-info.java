/**
 * Radio Manager Port
 * =============================================================================
 *
 * The boundary between the coordination layer and the platform radio manager
 * (a BLE stack, a simulator, or a test double).
 *
 * <p>Everything above this port sees only peripheral identifiers, readiness
 * states and opaque advertisement or restore payloads. Platform types never
 * cross it.</p>
 *
 * <h2>Constraints on implementations</h2>
 * <ul>
 *   <li>Commands may be rejected by throwing; the caller turns that into a
 *       resource error for the affected request.</li>
 *   <li>Notifications may arrive on any thread.</li>
 *   <li>No deduplication, deadlines or retries. Those live in the
 *       coordinators.</li>
 * </ul>
 */
package com.questrail.central.radio;
