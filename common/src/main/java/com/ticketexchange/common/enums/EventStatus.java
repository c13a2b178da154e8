package com.ticketexchange.common.enums;

public enum EventStatus {
    UPCOMING("Upcoming - accepting buyer offers"),
    ONGOING("Ongoing - doors open"),
    COMPLETED("Completed - event has ended"),
    CANCELLED("Cancelled - refunds processing");

    private final String description;

    EventStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean acceptsOffers() {
        return this == UPCOMING;
    }
}
