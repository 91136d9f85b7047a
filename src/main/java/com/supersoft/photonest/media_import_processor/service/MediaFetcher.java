package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.exception.MediaFetchException;

public interface MediaFetcher {

    boolean supports(PickerSelection.SourceType sourceType);

    /**
     * Copies the selection's bytes into a temp file.
     *
     * @throws MediaFetchException with a subtype telling authorization, expiry and transient failures apart
     */
    FetchedMedia fetch(PickerSelection selection) throws MediaFetchException;
}
