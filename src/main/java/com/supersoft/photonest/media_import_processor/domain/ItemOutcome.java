package com.supersoft.photonest.media_import_processor.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Result of processing one claimed selection, before it is written back.
 */
@Value
@Builder
public class ItemOutcome {
    PickerSelection.SelectionStatus status;
    PickerSelection.FailureKind failureKind;
    String errorMessage;
    Long mediaId;

    public static ItemOutcome imported(Long mediaId) {
        return ItemOutcome.builder().status(PickerSelection.SelectionStatus.IMPORTED).mediaId(mediaId).build();
    }

    public static ItemOutcome duplicate(Long mediaId) {
        return ItemOutcome.builder().status(PickerSelection.SelectionStatus.DUP).mediaId(mediaId).build();
    }

    public static ItemOutcome expired(String errorMessage) {
        return ItemOutcome.builder()
                .status(PickerSelection.SelectionStatus.EXPIRED)
                .failureKind(PickerSelection.FailureKind.RESOURCE_EXPIRED)
                .errorMessage(errorMessage)
                .build();
    }

    public static ItemOutcome failed(PickerSelection.FailureKind kind, String errorMessage) {
        return ItemOutcome.builder()
                .status(PickerSelection.SelectionStatus.FAILED)
                .failureKind(kind)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean isTransientFailure() {
        return status == PickerSelection.SelectionStatus.FAILED && failureKind == PickerSelection.FailureKind.TRANSIENT;
    }
}
