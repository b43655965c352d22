package com.fieldvault.session;

public enum KeyState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    FAILED
}
