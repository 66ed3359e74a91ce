package com.ewsaccount.domain;

import lombok.Value;

import java.util.List;

/**
 * Result of one GetEvents call: the events and the subscription state to poll with next
 */
@Value
public class EventBatch {

    List<Event> events;
    SubscriptionState nextState;
}
