package com.ewsaccount.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Options for a bulk item delete.
 * sendMeetingCancellations only applies to calendar items, affectedTaskOccurrences only to
 * recurring tasks.
 */
@Value
@Builder
public class DeleteOptions {

    @Builder.Default
    DeleteType deleteType = DeleteType.HARD_DELETE;
    @Builder.Default
    SendMeetingCancellations sendMeetingCancellations = SendMeetingCancellations.SEND_TO_NONE;
    @Builder.Default
    AffectedTaskOccurrences affectedTaskOccurrences = AffectedTaskOccurrences.SPECIFIED_OCCURRENCE_ONLY;
    @Builder.Default
    Boolean suppressReadReceipts = Boolean.TRUE;

    public static DeleteOptions defaults() {
        return DeleteOptions.builder().build();
    }
}
