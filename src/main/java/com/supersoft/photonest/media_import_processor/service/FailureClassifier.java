package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.PickerSelection.FailureKind;
import com.supersoft.photonest.media_import_processor.exception.AuthorizationFailureException;
import com.supersoft.photonest.media_import_processor.exception.ResourceExpiredException;
import com.supersoft.photonest.media_import_processor.exception.TransientFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientResponseException;

import java.nio.file.NoSuchFileException;
import java.util.regex.Pattern;

/**
 * Maps processing failures to a {@link FailureKind}. Anything not recognised is transient.
 */
@Slf4j
@Component
public class FailureClassifier {

    private static final Pattern AUTHORIZATION_PATTERNS = Pattern.compile(
        "(?i).*(unauthori[sz]ed|forbidden|invalid_grant|invalid_token|access denied|token (expired|revoked)).*"
    );

    private static final Pattern EXPIRED_PATTERNS = Pattern.compile(
        "(?i).*\\b(link expired|url expired|no longer available|gone|not found)\\b.*"
    );

    public FailureKind classify(Throwable failure) {
        if (failure instanceof AuthorizationFailureException) {
            return FailureKind.AUTHORIZATION;
        }
        if (failure instanceof ResourceExpiredException) {
            return FailureKind.RESOURCE_EXPIRED;
        }
        if (failure instanceof TransientFetchException) {
            return FailureKind.TRANSIENT;
        }

        if (failure instanceof RestClientResponseException) {
            int status = ((RestClientResponseException) failure).getStatusCode().value();
            if (status == 401 || status == 403) {
                return FailureKind.AUTHORIZATION;
            }
            if (status == 404 || status == 410) {
                return FailureKind.RESOURCE_EXPIRED;
            }
            return FailureKind.TRANSIENT;
        }

        if (failure instanceof NoSuchFileException) {
            return FailureKind.RESOURCE_EXPIRED;
        }

        String message = failure.getMessage();
        if (message != null) {
            if (AUTHORIZATION_PATTERNS.matcher(message).matches()) {
                return FailureKind.AUTHORIZATION;
            }
            if (EXPIRED_PATTERNS.matcher(message).matches()) {
                return FailureKind.RESOURCE_EXPIRED;
            }
        }

        return FailureKind.TRANSIENT;
    }

    public boolean isRetryable(FailureKind kind) {
        return kind != null && kind.isRetryable();
    }
}
