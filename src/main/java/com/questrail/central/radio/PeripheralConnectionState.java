package com.questrail.central.radio;

/**
 * Connection state of a peripheral as reported by the radio manager.
 */
public enum PeripheralConnectionState
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DISCONNECTING
}
