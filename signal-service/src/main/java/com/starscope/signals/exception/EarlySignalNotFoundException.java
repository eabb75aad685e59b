package com.starscope.signals.exception;

import com.starscope.common.exception.SignalException;

public class EarlySignalNotFoundException extends SignalException {

    public EarlySignalNotFoundException(long signalId) {
        super("EarlySignalService", "Early signal not found. id=" + signalId);
    }
}
