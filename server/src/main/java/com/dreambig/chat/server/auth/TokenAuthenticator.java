package com.dreambig.chat.server.auth;

import com.dreambig.chat.server.model.UserProfile;

import java.util.Optional;

/**
 * Resolves an opaque bearer token to the user it was issued to.
 */
public interface TokenAuthenticator {

    /**
     * @return the user, or empty when the token is unknown, expired or blank
     */
    Optional<UserProfile> authenticate(String token);
}
