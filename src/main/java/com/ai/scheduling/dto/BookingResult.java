package com.ai.scheduling.dto;

public record BookingResult(boolean success, BookingError error, String message, Long appointmentId) {

    public static BookingResult success(Long appointmentId, String message) {
        return new BookingResult(true, null, message, appointmentId);
    }

    public static BookingResult failure(BookingError error, String message) {
        return new BookingResult(false, error, message, null);
    }

    public static BookingResult invalid(String message) {
        return failure(BookingError.VALIDATION_ERROR, message);
    }

    public static BookingResult slotUnavailable(String message) {
        return failure(BookingError.SLOT_UNAVAILABLE, message);
    }

    public static BookingResult notFound(String message) {
        return failure(BookingError.NOT_FOUND, message);
    }
}
