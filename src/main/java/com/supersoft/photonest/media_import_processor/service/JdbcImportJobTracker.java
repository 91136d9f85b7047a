package com.supersoft.photonest.media_import_processor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supersoft.photonest.media_import_processor.domain.ImportJob;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;
import com.supersoft.photonest.media_import_processor.repository.ImportJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
public class JdbcImportJobTracker implements ImportJobTracker {

    @Autowired
    private ImportJobRepository jobRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Clock clock;

    @Override
    public ImportJob open(Long sessionId, String targetType) {
        LocalDateTime now = LocalDateTime.now(clock);
        ImportJob job = ImportJob.builder()
                .sessionId(sessionId)
                .targetType(targetType)
                .status(ImportJob.JobStatus.RUNNING)
                .startedAt(now)
                .createdAt(now)
                .build();
        jobRepository.insert(job);
        log.info("Opened import job {} for session {}", job.getId(), sessionId);
        return job;
    }

    @Override
    public int finalizeForSession(Long sessionId, boolean success, ImportSessionStats stats) {
        LocalDateTime now = LocalDateTime.now(clock);
        ImportJob.JobStatus status = success ? ImportJob.JobStatus.SUCCESS : ImportJob.JobStatus.FAILED;
        String statsJson = toJson(stats, now);

        int closed = 0;
        for (ImportJob job : jobRepository.findOpenBySessionId(sessionId)) {
            if (jobRepository.finish(job.getId(), status, statsJson, now)) {
                closed++;
                log.info("Import job {} of session {} finished as {}", job.getId(), sessionId, status);
            }
        }
        return closed;
    }

    private String toJson(ImportSessionStats stats, LocalDateTime completedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("countsByStatus", stats.getCountsByStatus());
        payload.put("total", stats.getTotal());
        payload.put("completedAt", completedAt.toString());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job stats", e);
        }
    }
}
