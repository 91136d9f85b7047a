package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.config.RabbitMQConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Parks the retry message in the delay queue with a per-message TTL. When it expires the broker
 * dead-letters it into the thumbnails queue.
 */
@Slf4j
@Service
public class RabbitThumbnailRetryScheduler implements ThumbnailRetryScheduler {

    @Autowired
    private RabbitTemplate rabbitTemplate;

    @Override
    public Optional<String> schedule(Long mediaId, boolean force, Duration countdown) {
        String jobId = UUID.randomUUID().toString();
        AssetGenerationPublisher.ThumbnailJobMessage message = new AssetGenerationPublisher.ThumbnailJobMessage(mediaId, force, jobId);

        rabbitTemplate.convertAndSend(RabbitMQConfig.MEDIA_ASSETS_EXCHANGE, RabbitMQConfig.THUMBNAILS_DELAY_ROUTING_KEY, message, m -> {
            m.getMessageProperties().setExpiration(String.valueOf(countdown.toMillis()));
            m.getMessageProperties().setMessageId(jobId);
            return m;
        });

        log.info("Scheduled thumbnail retry {} for media {} in {}s", jobId, mediaId, countdown.getSeconds());
        return Optional.of(jobId);
    }
}
