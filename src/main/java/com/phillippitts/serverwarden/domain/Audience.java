package com.phillippitts.serverwarden.domain;

/** Who a notification is addressed to. */
public enum Audience {
    ADMIN,
    PLAYER
}
