package com.ewsaccount.domain;

import lombok.Value;

/**
 * Item id paired with its opaque export payload (base64 in practice)
 */
@Value
public class ExportedItem {

    ItemId itemId;
    String data;
}
