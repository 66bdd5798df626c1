/**
 * Per-peripheral connect and disconnect coordination.
 *
 * <p>At most one request per peripheral and operation is pending at a time.
 * Callers arriving while it is pending join it and receive its outcome.</p>
 */
package com.questrail.central.internal.peripheral;
