package com.volumemonitor.broker;

import java.util.Optional;

public interface CredentialProvider {

    /** The current broker access token, empty when no valid session exists. */
    Optional<String> currentToken();
}
