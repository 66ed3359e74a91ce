package com.ewsaccount.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Event {

    EventType type;
    ItemId itemId;     // null for folder-level events
    String folderId;
    String watermark;
}
