package com.ewsaccount.domain;

/**
 * Attendee notification on calendar item delete
 */
public enum SendMeetingCancellations {
    SEND_TO_NONE,
    SEND_ONLY_TO_ALL,
    SEND_TO_ALL_AND_SAVE_COPY
}
