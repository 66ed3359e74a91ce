package com.ewsaccount.domain;

public enum DeleteType {
    HARD_DELETE,
    SOFT_DELETE,
    MOVE_TO_DELETED_ITEMS
}
