package com.starscope.signals.exception;

import com.starscope.common.exception.SignalException;

public class RepoNotFoundException extends SignalException {

    public RepoNotFoundException(String component, long repoId) {
        super(component, "Tracked repo not found. repoId=" + repoId);
    }
}
