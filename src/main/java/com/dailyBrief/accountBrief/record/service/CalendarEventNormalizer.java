package com.dailyBrief.accountBrief.record.service;

import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.dailyBrief.accountBrief.record.model.CalendarEvent;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import org.springframework.stereotype.Service;

/**
 * Normalizes provider calendar events to {@link CalendarEvent}.
 */
@Service
public class CalendarEventNormalizer {

    static final String NO_TITLE = "(No title)";

    public CalendarEvent normalize(RawRecord event, AccountClassification accountType) {
        String summary = event.string("summary");
        return CalendarEvent.builder()
                .summary(summary.isEmpty() ? NO_TITLE : summary)
                .start(eventTime(event.object("start")))
                .end(eventTime(event.object("end")))
                .location(event.string("location"))
                .status(event.string("status"))
                .response(ownResponse(event))
                .accountType(accountType)
                .build();
    }

    /**
     * Timed events carry dateTime, all-day events only date.
     */
    private String eventTime(RawRecord time) {
        String dateTime = time.string("dateTime");
        return dateTime.isEmpty() ? time.string("date") : dateTime;
    }

    /**
     * Response status of the attendee entry flagged as self.
     */
    private String ownResponse(RawRecord event) {
        for (RawRecord attendee : event.objects("attendees")) {
            if (attendee.bool("self")) {
                return attendee.string("responseStatus");
            }
        }
        return "";
    }
}
