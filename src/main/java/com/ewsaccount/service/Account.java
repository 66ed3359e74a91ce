package com.ewsaccount.service;

import com.ewsaccount.domain.AccessType;
import com.ewsaccount.domain.Credentials;
import com.ewsaccount.domain.DeleteOptions;
import com.ewsaccount.domain.DeleteResult;
import com.ewsaccount.domain.DiscoveryResult;
import com.ewsaccount.domain.EventType;
import com.ewsaccount.domain.ExportedItem;
import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.FolderType;
import com.ewsaccount.domain.ItemChange;
import com.ewsaccount.domain.ItemId;
import com.ewsaccount.domain.Protocol;
import com.ewsaccount.domain.ProtocolConfig;
import com.ewsaccount.domain.UpdateOptions;
import com.ewsaccount.domain.UploadItem;
import com.ewsaccount.errors.ConfigurationConflictException;
import com.ewsaccount.errors.InvalidIdentityException;
import com.ewsaccount.localization.LocalizationTable;
import com.ewsaccount.localization.LocalizedFolderNames;
import com.ewsaccount.subscription.Subscription;
import com.ewsaccount.transport.Autodiscovery;
import com.ewsaccount.transport.ExchangeService;
import com.ewsaccount.util.NameUtil;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mailbox account on the remote service. The primary key is the primary SMTP address.
 * <p>
 * The folder directory, the root folder and every default folder are looked up on first access
 * and kept for the lifetime of the instance. Server-side folder changes need a new Account.
 */
@Slf4j
@Getter
public class Account {

    public static final String DEFAULT_LOCALE = "da_DK";

    private final String primarySmtpAddress;
    private final String fullname;
    private final String locale;
    private final AccessType accessType;
    private final Protocol protocol;
    /**
     * Server version for this account. Can differ from what autodiscovery first reports when
     * requests are delegated to an older backend.
     */
    private final String version;

    @Getter(AccessLevel.NONE)
    private final ExchangeService exchangeService;
    @Getter(AccessLevel.NONE)
    private final DefaultFolderResolver resolver;
    @Getter(AccessLevel.NONE)
    private final FolderTreeDiscoverer discoverer;

    // Guards root, folders and defaults
    @Getter(AccessLevel.NONE)
    private final Object lock = new Object();
    @Getter(AccessLevel.NONE)
    private Folder root;
    @Getter(AccessLevel.NONE)
    private FolderDirectory folders;
    @Getter(AccessLevel.NONE)
    private final Map<FolderType, Folder> defaults = new EnumMap<>(FolderType.class);

    /**
     * @param autodiscover       locate the endpoint via {@code autodiscovery}; needs credentials, excludes {@code config}
     * @param config             explicit protocol, required when not autodiscovering
     * @param accessType         null means DELEGATE with credentials, IMPERSONATION without
     * @param verifySsl          null means true
     * @param locale             null means {@link #DEFAULT_LOCALE}
     * @param localizationTable  null means the built-in {@link LocalizedFolderNames}
     */
    @Builder
    public Account(String primarySmtpAddress, String fullname, AccessType accessType, boolean autodiscover,
                   Credentials credentials, ProtocolConfig config, Boolean verifySsl, String locale,
                   ExchangeService exchangeService, Autodiscovery autodiscovery,
                   LocalizationTable localizationTable) {
        if (!NameUtil.isEmailAddress(primarySmtpAddress)) {
            throw new InvalidIdentityException(
                    "primary_smtp_address '" + primarySmtpAddress + "' is not an email address");
        }
        this.exchangeService = Objects.requireNonNull(exchangeService, "exchangeService");
        this.fullname = fullname;
        this.locale = locale != null ? locale : DEFAULT_LOCALE;
        // Delegate access if individual credentials are given, else a service user with impersonation
        this.accessType = accessType != null ? accessType
                : (credentials != null ? AccessType.DELEGATE : AccessType.IMPERSONATION);

        if (autodiscover) {
            if (config != null) {
                throw new ConfigurationConflictException("config must not be given when autodiscover is active");
            }
            if (credentials == null) {
                throw new ConfigurationConflictException("autodiscover requires credentials");
            }
            if (autodiscovery == null) {
                throw new ConfigurationConflictException("autodiscover requires an autodiscovery service");
            }
            DiscoveryResult discovered = autodiscovery.discover(primarySmtpAddress, credentials,
                    verifySsl == null || verifySsl);
            this.primarySmtpAddress = discovered.getPrimarySmtpAddress() != null
                    ? discovered.getPrimarySmtpAddress() : primarySmtpAddress;
            this.protocol = discovered.getProtocol();
        } else {
            if (config == null) {
                throw new ConfigurationConflictException("non-autodiscover requires a config");
            }
            this.primarySmtpAddress = primarySmtpAddress;
            this.protocol = config.getProtocol();
        }
        if (this.protocol == null) {
            throw new ConfigurationConflictException("No protocol for " + this.primarySmtpAddress);
        }
        this.version = protocol.getVersion();

        LocalizationTable table = localizationTable != null ? localizationTable : new LocalizedFolderNames();
        this.resolver = new DefaultFolderResolver(exchangeService, table);
        this.discoverer = new FolderTreeDiscoverer(exchangeService);
        log.debug("Added account: {}", this);
    }

    public String getDomain() {
        return NameUtil.extractDomain(primarySmtpAddress);
    }

    /**
     * Mailbox root, fetched by distinguished id on first access
     */
    public Folder getRoot() {
        synchronized (lock) {
            if (root == null) {
                root = exchangeService.getFolderByDistinguishedId(this, FolderType.ROOT);
            }
            return root;
        }
    }

    /**
     * All account folders grouped by type, discovered on first access
     */
    public FolderDirectory getFolders() {
        synchronized (lock) {
            if (folders == null) {
                folders = discoverer.discover(this, getRoot());
            }
            return folders;
        }
    }

    /**
     * Default folder of a well-known type, resolved on first access
     */
    public Folder getDefaultFolder(FolderType type) {
        if (type == null || !type.isWellKnown()) {
            throw new IllegalArgumentException("Not a well-known folder type: " + type);
        }
        if (type == FolderType.ROOT) {
            return getRoot();
        }
        synchronized (lock) {
            Folder folder = defaults.get(type);
            if (folder == null) {
                folder = resolver.resolve(this, type);
                defaults.put(type, folder);
            }
            return folder;
        }
    }

    /**
     * If the account holds a shared calendar from another user, that calendar shows up in the
     * folder list too; this returns the account's own.
     */
    public Folder getCalendar() {
        return getDefaultFolder(FolderType.CALENDAR);
    }

    public Folder getTrash() {
        return getDefaultFolder(FolderType.DELETED_ITEMS);
    }

    public Folder getDrafts() {
        return getDefaultFolder(FolderType.DRAFTS);
    }

    public Folder getInbox() {
        return getDefaultFolder(FolderType.INBOX);
    }

    public Folder getOutbox() {
        return getDefaultFolder(FolderType.OUTBOX);
    }

    public Folder getSent() {
        return getDefaultFolder(FolderType.SENT_ITEMS);
    }

    public Folder getJunk() {
        return getDefaultFolder(FolderType.JUNK_EMAIL);
    }

    public Folder getTasks() {
        return getDefaultFolder(FolderType.TASKS);
    }

    public Folder getContacts() {
        return getDefaultFolder(FolderType.CONTACTS);
    }

    public Folder getRecoverableItemsRoot() {
        return getDefaultFolder(FolderType.RECOVERABLE_ITEMS_ROOT);
    }

    public Folder getRecoverableDeletedItems() {
        return getDefaultFolder(FolderType.RECOVERABLE_ITEMS_DELETIONS);
    }

    /**
     * Update items in bulk.
     *
     * @return ids of the updated items; empty without a remote call when {@code items} is empty
     */
    public List<ItemId> bulkUpdate(Iterable<ItemChange> items, UpdateOptions options) {
        requireOption(options, "options");
        requireOption(options.getConflictResolution(), "conflictResolution");
        requireOption(options.getMessageDisposition(), "messageDisposition");
        requireOption(options.getSendMeetingInvitationsOrCancellations(), "sendMeetingInvitationsOrCancellations");
        requireOption(options.getSuppressReadReceipts(), "suppressReadReceipts");
        log.debug("Updating items for {} (conflict_resolution {}, message_disposition: {}, send_meeting_invitations: {})",
                this, options.getConflictResolution(), options.getMessageDisposition(),
                options.getSendMeetingInvitationsOrCancellations());

        List<ItemChange> list = toList(items);
        if (list.isEmpty()) {
            return Collections.emptyList();
        }
        return exchangeService.bulkUpdate(this, list, options);
    }

    public List<ItemId> bulkUpdate(Iterable<ItemChange> items) {
        return bulkUpdate(items, UpdateOptions.defaults());
    }

    /**
     * Delete items in bulk.
     *
     * @return one result per id; empty without a remote call when {@code ids} is empty
     */
    public List<DeleteResult> bulkDelete(Iterable<ItemId> ids, DeleteOptions options) {
        requireOption(options, "options");
        requireOption(options.getDeleteType(), "deleteType");
        requireOption(options.getSendMeetingCancellations(), "sendMeetingCancellations");
        requireOption(options.getAffectedTaskOccurrences(), "affectedTaskOccurrences");
        requireOption(options.getSuppressReadReceipts(), "suppressReadReceipts");
        log.debug("Deleting items for {} (delete_type: {}, send_meeting_invitations: {}, affected_task_occurences: {})",
                this, options.getDeleteType(), options.getSendMeetingCancellations(),
                options.getAffectedTaskOccurrences());

        List<ItemId> list = toList(ids);
        if (list.isEmpty()) {
            return Collections.emptyList();
        }
        return exchangeService.bulkDelete(this, list, options);
    }

    public List<DeleteResult> bulkDelete(Iterable<ItemId> ids) {
        return bulkDelete(ids, DeleteOptions.defaults());
    }

    /**
     * Export items, each paired with its export payload
     */
    public List<ExportedItem> export(List<ItemId> ids) {
        List<String> data = exchangeService.exportItems(this, ids);
        List<ExportedItem> result = new ArrayList<>(Math.min(ids.size(), data.size()));
        for (int i = 0; i < ids.size() && i < data.size(); i++) {
            result.add(new ExportedItem(ids.get(i), data.get(i)));
        }
        return result;
    }

    /**
     * Upload export payloads, each already paired with its target folder
     */
    public List<ItemId> upload(List<UploadItem> items) {
        return exchangeService.uploadItems(this, items);
    }

    /**
     * Upload all payloads into one folder
     */
    public List<ItemId> upload(Folder folder, List<String> data) {
        List<UploadItem> items = new ArrayList<>(data.size());
        for (String d : data) {
            items.add(new UploadItem(folder, d));
        }
        return upload(items);
    }

    /**
     * Upload payloads pairwise into folders; extra entries on either side are ignored
     */
    public List<ItemId> upload(List<Folder> folders, List<String> data) {
        int n = Math.min(folders.size(), data.size());
        List<UploadItem> items = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            items.add(new UploadItem(folders.get(i), data.get(i)));
        }
        return upload(items);
    }

    public Subscription subscribe(Folder folder, Set<EventType> events, int timeoutMinutes) {
        return new Subscription(this, exchangeService, folder, events, timeoutMinutes);
    }

    public Subscription subscribe(Folder folder) {
        return subscribe(folder, EventType.ALL, Subscription.DEFAULT_TIMEOUT_MINUTES);
    }

    private static void requireOption(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static <T> List<T> toList(Iterable<T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items is required");
        }
        List<T> list = new ArrayList<>();
        items.forEach(list::add);
        return list;
    }

    @Override
    public String toString() {
        return fullname != null ? primarySmtpAddress + " (" + fullname + ")" : primarySmtpAddress;
    }
}
