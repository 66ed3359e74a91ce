package com.ewsaccount.domain;

import lombok.Value;

/**
 * Per-item outcome of a bulk delete
 */
@Value
public class DeleteResult {

    ItemId itemId;
    boolean success;
    String errorMessage; // null on success

    public static DeleteResult ok(ItemId itemId) {
        return new DeleteResult(itemId, true, null);
    }

    public static DeleteResult failed(ItemId itemId, String errorMessage) {
        return new DeleteResult(itemId, false, errorMessage);
    }
}
