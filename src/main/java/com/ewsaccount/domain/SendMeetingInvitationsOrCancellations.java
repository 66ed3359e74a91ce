package com.ewsaccount.domain;

/**
 * Attendee notification on calendar item update
 */
public enum SendMeetingInvitationsOrCancellations {
    SEND_TO_NONE,
    SEND_ONLY_TO_ALL,
    SEND_ONLY_TO_CHANGED,
    SEND_TO_ALL_AND_SAVE_COPY,
    SEND_TO_CHANGED_AND_SAVE_COPY
}
