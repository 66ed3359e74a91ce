package com.ewsaccount.transport;

import com.ewsaccount.domain.DeleteOptions;
import com.ewsaccount.domain.DeleteResult;
import com.ewsaccount.domain.Depth;
import com.ewsaccount.domain.EventBatch;
import com.ewsaccount.domain.EventType;
import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.FolderType;
import com.ewsaccount.domain.ItemChange;
import com.ewsaccount.domain.ItemId;
import com.ewsaccount.domain.SubscriptionState;
import com.ewsaccount.domain.UpdateOptions;
import com.ewsaccount.domain.UploadItem;
import com.ewsaccount.service.Account;

import java.util.List;
import java.util.Set;

/**
 * Remote call layer of the mailbox service.
 * <p>
 * Every call is synchronous and receives the calling {@link Account} so the implementation can
 * read its protocol, primary address and access type. Implementations own timeouts and retries;
 * failures surface as {@link com.ewsaccount.errors.TransportException} unless stated otherwise.
 */
public interface ExchangeService {

    /**
     * Fetch the canonical folder of a well-known type.
     *
     * @throws com.ewsaccount.errors.FolderNotFoundException if the server has no such folder
     * @throws com.ewsaccount.errors.AccessDeniedException   if the account may not fetch folders by id
     */
    Folder getFolderByDistinguishedId(Account account, FolderType type);

    /**
     * List the children of {@code parent}, immediate only or the whole subtree, in server order.
     */
    List<Folder> listChildFolders(Account account, Folder parent, Depth depth);

    /**
     * Run a query that matches nothing against {@code folder}, only to prove it is usable.
     */
    void checkQueryAccess(Account account, Folder folder);

    List<ItemId> bulkUpdate(Account account, List<ItemChange> items, UpdateOptions options);

    List<DeleteResult> bulkDelete(Account account, List<ItemId> ids, DeleteOptions options);

    /**
     * Export items; the returned payloads are in the order of {@code ids}.
     */
    List<String> exportItems(Account account, List<ItemId> ids);

    List<ItemId> uploadItems(Account account, List<UploadItem> items);

    /**
     * Create a pull subscription on {@code folder}.
     *
     * @param timeoutMinutes minutes the server keeps the subscription alive between polls
     */
    SubscriptionState subscribe(Account account, Folder folder, Set<EventType> events, int timeoutMinutes);

    EventBatch getEvents(Account account, SubscriptionState state);

    boolean unsubscribe(Account account, SubscriptionState state);
}
