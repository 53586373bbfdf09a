package com.ai.scheduling.dto;

public enum BookingError {
    /** Malformed identity key or date, or a missing/mismatched reference. Nothing was written. */
    VALIDATION_ERROR,
    /** The slot is held by someone else or does not exist. Retry with another slot. */
    SLOT_UNAVAILABLE,
    NOT_FOUND,
    ALREADY_CANCELLED,
    /** Connectivity, timeout or constraint failure. Rolled back; safe to retry as is. */
    STORAGE_ERROR
}
