package com.starscope.common.exception;

/**
 * Base of the engine's domain failures. The message is prefixed with the
 * component that raised it, e.g. {@code [EarlySignalService] Early signal not found. id=7}.
 */
public class SignalException extends RuntimeException {

    public SignalException(String component, String message) {
        super("[" + component + "] " + message);
    }
}
