package com.ticketexchange.common.enums;

public enum DeliveryMethod {
    ELECTRONIC,
    MOBILE_TRANSFER,
    WILL_CALL,
    PHYSICAL_SHIPPING
}
