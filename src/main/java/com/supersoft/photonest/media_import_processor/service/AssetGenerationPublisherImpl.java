package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.config.RabbitMQConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class AssetGenerationPublisherImpl implements AssetGenerationPublisher {

    @Autowired
    private RabbitTemplate rabbitTemplate;

    @Override
    public void requestThumbnails(Long mediaId, boolean force) {
        rabbitTemplate.convertAndSend(RabbitMQConfig.MEDIA_ASSETS_EXCHANGE, RabbitMQConfig.THUMBNAILS_ROUTING_KEY,
                new ThumbnailJobMessage(mediaId, force, null));
        log.debug("Requested thumbnails for media {}", mediaId);
    }

    @Override
    public void requestPlayback(Long mediaId) {
        rabbitTemplate.convertAndSend(RabbitMQConfig.MEDIA_ASSETS_EXCHANGE, RabbitMQConfig.PLAYBACK_ROUTING_KEY,
                new PlaybackJobMessage(mediaId));
        log.debug("Requested playback transcode for media {}", mediaId);
    }
}
