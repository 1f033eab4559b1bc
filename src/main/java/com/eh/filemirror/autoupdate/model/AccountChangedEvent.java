package com.eh.filemirror.autoupdate.model;

/**
 * Published on account switch and on logout. {@code current} is null after a logout.
 */
public record AccountChangedEvent(Account previous, Account current) {
}
