package com.alertrelay.pipeline.api;

import java.util.Optional;

@FunctionalInterface
public interface IdentityProvider {
    Optional<Identity> currentIdentity();

    static IdentityProvider none() {
        return Optional::empty;
    }
}
