package com.ewsaccount.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Notification event kinds a folder subscription can watch
 */
@Getter
@RequiredArgsConstructor
public enum EventType {

    COPIED("CopiedEvent"),
    CREATED("CreatedEvent"),
    DELETED("DeletedEvent"),
    MODIFIED("ModifiedEvent"),
    MOVED("MovedEvent"),
    NEW_MAIL("NewMailEvent"),
    FREE_BUSY_CHANGED("FreeBusyChangedEvent");

    public static final Set<EventType> ALL = Collections.unmodifiableSet(EnumSet.allOf(EventType.class));

    private final String wireName;
}
