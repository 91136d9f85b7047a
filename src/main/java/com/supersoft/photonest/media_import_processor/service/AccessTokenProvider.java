package com.supersoft.photonest.media_import_processor.service;

import java.util.Optional;

/**
 * Supplies OAuth access tokens for the remote picker. The token exchange lives outside this service.
 */
public interface AccessTokenProvider {
    Optional<String> accessTokenForSession(Long sessionId);
}
