package com.ewsaccount.subscription;

import com.ewsaccount.domain.Event;
import com.ewsaccount.domain.EventBatch;
import com.ewsaccount.domain.EventType;
import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.SubscriptionState;
import com.ewsaccount.service.Account;
import com.ewsaccount.transport.ExchangeService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * Pull subscription on a single folder.
 * Each {@link #getEvents()} call continues from the watermark returned by the previous one.
 */
@Slf4j
public class Subscription {

    public static final int DEFAULT_TIMEOUT_MINUTES = 20;

    private final Account account;
    private final ExchangeService exchangeService;
    private final Folder folder;
    private SubscriptionState state;

    public Subscription(Account account, ExchangeService exchangeService, Folder folder,
                        Set<EventType> events, int timeoutMinutes) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        if (timeoutMinutes < 1) {
            throw new IllegalArgumentException("Timeout must be at least 1 minute: " + timeoutMinutes);
        }
        this.account = account;
        this.exchangeService = exchangeService;
        this.folder = folder;
        this.state = exchangeService.subscribe(account, folder, events, timeoutMinutes);
        log.debug("Subscribed to {} on {} for {}", events, folder, account);
    }

    /**
     * Fetch events since the last call
     */
    public synchronized List<Event> getEvents() {
        EventBatch batch = exchangeService.getEvents(account, state);
        state = batch.getNextState();
        return batch.getEvents();
    }

    public synchronized boolean unsubscribe() {
        boolean result = exchangeService.unsubscribe(account, state);
        log.debug("Unsubscribed from {} for {}: {}", folder, account, result);
        return result;
    }

    public synchronized SubscriptionState getState() {
        return state;
    }

    public Folder getFolder() {
        return folder;
    }
}
