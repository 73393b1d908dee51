package com.profilebundler.models;

/**
 * Raised when a property value or adjustment cannot be interpreted as a number with a unit.
 */
public class ProfileValueException extends Exception {

    public ProfileValueException(String message) {
        super(message);
    }
}
