package com.ewsaccount.domain;

import lombok.Value;

import java.util.List;

/**
 * An item together with the names of the fields that changed on it
 */
@Value
public class ItemChange {

    ItemId itemId;
    List<String> changedFields;
}
