package com.supersoft.photonest.media_import_processor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaRecord {
    private Long id;
    private Long accountId;
    private String sourceReference;
    private String hashSha256;
    private long sizeBytes;
    private String mimeType;
    private String filename;
    private String localRelPath;
    private boolean video;
    private LocalDateTime shotAt;
    private LocalDateTime importedAt;
}
