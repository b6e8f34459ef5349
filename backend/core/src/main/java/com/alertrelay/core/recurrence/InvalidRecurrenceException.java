package com.alertrelay.core.recurrence;

public class InvalidRecurrenceException extends IllegalArgumentException {
    public InvalidRecurrenceException(String message) {
        super(message);
    }
}
