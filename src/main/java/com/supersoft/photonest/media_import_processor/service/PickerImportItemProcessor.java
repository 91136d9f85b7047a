package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.ItemOutcome;
import com.supersoft.photonest.media_import_processor.domain.ItemState;
import com.supersoft.photonest.media_import_processor.domain.MediaRecord;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection.FailureKind;
import com.supersoft.photonest.media_import_processor.repository.ImportSessionRepository;
import com.supersoft.photonest.media_import_processor.repository.MediaRepository;
import com.supersoft.photonest.media_import_processor.util.MediaFileNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Imports one claimed selection: fetch, hash, dedupe, store the original, write the catalog row
 * and kick off thumbnail and playback generation. Returns the outcome; the caller owns the claim
 * and writes the result back.
 */
@Slf4j
@Service
public class PickerImportItemProcessor {

    private static final String SOURCE_TAG_PICKER = "picker";
    private static final String SOURCE_TAG_LOCAL = "local";

    @Autowired
    private List<MediaFetcher> mediaFetchers;

    @Autowired
    private OriginalsStorage originalsStorage;

    @Autowired
    private MediaRepository mediaRepository;

    @Autowired
    private ImportSessionRepository sessionRepository;

    @Autowired
    private AssetGenerationPublisher assetGenerationPublisher;

    @Autowired
    private FailureClassifier failureClassifier;

    @Autowired
    private StateTransitionRecorder transitionRecorder;

    @Autowired
    private Clock clock;

    public ItemOutcome process(PickerSelection selection) {
        ItemStateMachine phases = new ItemStateMachine(ItemState.PENDING, clock);
        try {
            return runPhases(selection, phases);
        } finally {
            transitionRecorder.recordAll(StateTransitionRecorder.ENTITY_SELECTION, selection.getId(), phases.getHistory());
        }
    }

    private ItemOutcome runPhases(PickerSelection selection, ItemStateMachine phases) {
        phases.transition(ItemState.ANALYZING, "fetching from " + selection.getSourceType());

        FetchedMedia fetched;
        try {
            fetched = fetcherFor(selection.getSourceType()).fetch(selection);
        } catch (Exception e) {
            FailureKind kind = failureClassifier.classify(e);
            log.warn("Fetch failed for selection {} ({}): {}", selection.getId(), kind, e.getMessage());
            if (kind == FailureKind.RESOURCE_EXPIRED) {
                phases.transition(ItemState.MISSING, e.getMessage());
                return ItemOutcome.expired(e.getMessage());
            }
            phases.transition(ItemState.FAILED, e.getMessage());
            return ItemOutcome.failed(kind, e.getMessage());
        }

        try {
            phases.transition(ItemState.CHECKING, "hashing " + fetched.getSizeBytes() + " bytes");
            String sha256 = MediaFileNames.sha256(fetched.getTempFile());

            Optional<MediaRecord> existing = mediaRepository.findByHash(sha256);
            if (existing.isPresent()) {
                phases.transition(ItemState.SKIPPED, "duplicate of media " + existing.get().getId());
                log.info("Selection {} is a duplicate of media {}", selection.getId(), existing.get().getId());
                return ItemOutcome.duplicate(existing.get().getId());
            }

            phases.transition(ItemState.MOVING, "storing original");
            String extension = MediaFileNames.extensionFor(fetched.getFilename(), fetched.getMimeType());
            String relativePath = originalsStorage.storeOriginal(fetched.getTempFile(), sha256, fetched.getShotAt(),
                    sourceTag(selection.getSourceType()), extension);

            phases.transition(ItemState.UPDATING, "writing catalog row", Map.of("path", relativePath));
            MediaRecord media = MediaRecord.builder()
                    .accountId(accountIdOf(selection))
                    .sourceReference(selection.getSourceReference())
                    .hashSha256(sha256)
                    .sizeBytes(fetched.getSizeBytes())
                    .mimeType(fetched.getMimeType())
                    .filename(fetched.getFilename())
                    .localRelPath(relativePath)
                    .video(fetched.isVideo())
                    .shotAt(fetched.getShotAt())
                    .importedAt(LocalDateTime.now(clock))
                    .build();
            try {
                mediaRepository.insert(media);
            } catch (DuplicateKeyException e) {
                // another worker imported the same bytes between our lookup and insert
                Optional<MediaRecord> winner = mediaRepository.findByHash(sha256);
                if (winner.isPresent()) {
                    if (!relativePath.equals(winner.get().getLocalRelPath())) {
                        originalsStorage.discard(originalsStorage.resolve(relativePath));
                    }
                    phases.forceTransition(ItemState.SKIPPED, "duplicate inserted concurrently", Map.of("mediaId", winner.get().getId()));
                    return ItemOutcome.duplicate(winner.get().getId());
                }
                throw e;
            }

            phases.transition(ItemState.IMPORTED, "media " + media.getId());
            log.info("Imported selection {} as media {} ({})", selection.getId(), media.getId(), relativePath);

            requestDerivatives(media);
            return ItemOutcome.imported(media.getId());

        } catch (IOException e) {
            phases.transition(ItemState.FAILED, e.getMessage());
            log.warn("I/O failure importing selection {}: {}", selection.getId(), e.getMessage());
            return ItemOutcome.failed(FailureKind.TRANSIENT, e.getMessage());
        } finally {
            originalsStorage.discard(fetched.getTempFile());
        }
    }

    /**
     * Fire-and-forget: generation runs elsewhere and a publish failure never fails the import.
     */
    private void requestDerivatives(MediaRecord media) {
        try {
            assetGenerationPublisher.requestThumbnails(media.getId(), false);
            if (media.isVideo()) {
                assetGenerationPublisher.requestPlayback(media.getId());
            }
        } catch (Exception e) {
            log.error("Failed to request derivatives for media {}: {}", media.getId(), e.getMessage(), e);
        }
    }

    private MediaFetcher fetcherFor(PickerSelection.SourceType sourceType) {
        for (MediaFetcher fetcher : mediaFetchers) {
            if (fetcher.supports(sourceType)) {
                return fetcher;
            }
        }
        throw new IllegalStateException("No media fetcher for source type " + sourceType);
    }

    private Long accountIdOf(PickerSelection selection) {
        return sessionRepository.findById(selection.getSessionId())
                .map(ImportSession::getAccountId)
                .orElseThrow(() -> new IllegalStateException("Session " + selection.getSessionId() + " not found"));
    }

    private static String sourceTag(PickerSelection.SourceType sourceType) {
        return sourceType == PickerSelection.SourceType.LOCAL ? SOURCE_TAG_LOCAL : SOURCE_TAG_PICKER;
    }
}
