package com.hcltech.kpc.common.lifecycle;

public enum LifecycleState {
    NOT_STARTED,
    RUNNING,
    STOPPED
}
