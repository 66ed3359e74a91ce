package com.ewsaccount.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Options for a bulk item update.
 * messageDisposition only applies to messages, sendMeetingInvitationsOrCancellations only to
 * calendar items, suppressReadReceipts needs Exchange 2013 or later.
 */
@Value
@Builder
public class UpdateOptions {

    @Builder.Default
    ConflictResolution conflictResolution = ConflictResolution.AUTO_RESOLVE;
    @Builder.Default
    MessageDisposition messageDisposition = MessageDisposition.SAVE_ONLY;
    @Builder.Default
    SendMeetingInvitationsOrCancellations sendMeetingInvitationsOrCancellations =
            SendMeetingInvitationsOrCancellations.SEND_TO_NONE;
    @Builder.Default
    Boolean suppressReadReceipts = Boolean.TRUE;

    public static UpdateOptions defaults() {
        return UpdateOptions.builder().build();
    }
}
