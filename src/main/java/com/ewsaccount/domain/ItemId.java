package com.ewsaccount.domain;

import lombok.Value;

@Value
public class ItemId {

    String id;
    String changeKey;
}
