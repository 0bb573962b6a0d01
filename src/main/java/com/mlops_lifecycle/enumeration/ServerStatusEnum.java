package com.mlops_lifecycle.enumeration;

public enum ServerStatusEnum {
    UNINITIALIZED,
    READY,
    UNAVAILABLE
}
