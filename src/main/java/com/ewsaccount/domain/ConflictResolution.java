package com.ewsaccount.domain;

public enum ConflictResolution {
    NEVER_OVERWRITE,
    AUTO_RESOLVE,
    ALWAYS_OVERWRITE
}
