package com.ewsaccount.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Well-known folder roles of a mailbox.
 * Each role carries the distinguished folder id the server uses for its canonical instance.
 */
@Getter
@RequiredArgsConstructor
public enum FolderType {

    ROOT("root"),
    CALENDAR("calendar"),
    DELETED_ITEMS("deleteditems"),
    DRAFTS("drafts"),
    INBOX("inbox"),
    OUTBOX("outbox"),
    SENT_ITEMS("sentitems"),
    JUNK_EMAIL("junkemail"),
    TASKS("tasks"),
    CONTACTS("contacts"),
    RECOVERABLE_ITEMS_ROOT("recoverableitemsroot"),
    RECOVERABLE_ITEMS_DELETIONS("recoverableitemsdeletions"),
    OTHER(null);

    private final String distinguishedId; // null for OTHER

    public boolean isWellKnown() {
        return distinguishedId != null;
    }
}
