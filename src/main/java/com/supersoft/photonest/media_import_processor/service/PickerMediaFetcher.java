package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.exception.AuthorizationFailureException;
import com.supersoft.photonest.media_import_processor.exception.MediaFetchException;
import com.supersoft.photonest.media_import_processor.exception.ResourceExpiredException;
import com.supersoft.photonest.media_import_processor.exception.TransientFetchException;
import com.supersoft.photonest.media_import_processor.util.MediaFileNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Downloads picker selections from their provider base URL with the account's bearer token.
 */
@Slf4j
@Component
public class PickerMediaFetcher implements MediaFetcher {

    @Autowired
    private RestTemplate restTemplate;

    @Autowired
    private OriginalsStorage originalsStorage;

    @Autowired
    private ObjectProvider<AccessTokenProvider> accessTokenProvider;

    @Value("${picker.import.fetch.download-param:d}")
    private String downloadParam;

    @Value("${picker.import.fetch.video-download-param:dv}")
    private String videoDownloadParam;

    @Override
    public boolean supports(PickerSelection.SourceType sourceType) {
        return sourceType == PickerSelection.SourceType.PICKER;
    }

    @Override
    public FetchedMedia fetch(PickerSelection selection) throws MediaFetchException {
        if (selection.getBaseUrl() == null || selection.getBaseUrl().isBlank()) {
            throw new ResourceExpiredException("Selection " + selection.getId() + " has no download URL");
        }

        AccessTokenProvider provider = accessTokenProvider.getIfAvailable();
        if (provider == null) {
            throw new AuthorizationFailureException("No access token provider configured");
        }
        Optional<String> token = provider.accessTokenForSession(selection.getSessionId());
        if (token.isEmpty()) {
            throw new AuthorizationFailureException("No access token for session " + selection.getSessionId());
        }

        URI uri = URI.create(selection.getBaseUrl() + "=" + (selection.isVideo() ? videoDownloadParam : downloadParam));
        Path temp = stageDownload(selection);

        try {
            MediaType contentType = restTemplate.execute(uri, HttpMethod.GET,
                    request -> request.getHeaders().setBearerAuth(token.get()),
                    response -> {
                        try (InputStream body = response.getBody()) {
                            Files.copy(body, temp, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return response.getHeaders().getContentType();
                    });

            String mimeType = selection.getMimeType() != null
                    ? selection.getMimeType()
                    : (contentType != null ? contentType.getType() + "/" + contentType.getSubtype() : null);
            long size = Files.size(temp);
            log.debug("Downloaded selection {} ({} bytes)", selection.getId(), size);

            return FetchedMedia.builder()
                    .tempFile(temp)
                    .filename(selection.getFilename())
                    .mimeType(mimeType)
                    .sizeBytes(size)
                    .video(mimeType != null && mimeType.startsWith("video/"))
                    .build();
        } catch (HttpClientErrorException e) {
            originalsStorage.discard(temp);
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                throw new AuthorizationFailureException("Picker rejected credentials (" + status + ")", e);
            }
            if (status == 404 || status == 410) {
                throw new ResourceExpiredException("Picker media no longer available (" + status + ")", e);
            }
            throw new TransientFetchException("Picker download failed (" + status + ")", e);
        } catch (RestClientException | IOException e) {
            originalsStorage.discard(temp);
            throw new TransientFetchException("Picker download failed: " + e.getMessage(), e);
        }
    }

    private Path stageDownload(PickerSelection selection) throws TransientFetchException {
        try {
            return originalsStorage.createTempFile(MediaFileNames.extensionFor(selection.getFilename(), selection.getMimeType()));
        } catch (IOException e) {
            throw new TransientFetchException("Unable to stage download: " + e.getMessage(), e);
        }
    }
}
