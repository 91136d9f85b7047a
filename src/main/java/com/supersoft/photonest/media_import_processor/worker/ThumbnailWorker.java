package com.supersoft.photonest.media_import_processor.worker;

import com.supersoft.photonest.media_import_processor.config.RabbitMQConfig;
import com.supersoft.photonest.media_import_processor.service.AssetGenerationPublisher;
import com.supersoft.photonest.media_import_processor.service.ThumbnailGenerationService;
import com.supersoft.photonest.media_import_processor.service.ThumbnailRetryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ThumbnailWorker {

    @Autowired
    private ThumbnailGenerationService generationService;

    @Autowired
    private ThumbnailRetryService retryService;

    @RabbitListener(queues = RabbitMQConfig.THUMBNAILS_QUEUE)
    public void onThumbnailJob(AssetGenerationPublisher.ThumbnailJobMessage message) {
        try {
            if (message.getJobId() != null && !retryService.beginAttempt(message.getMediaId(), message.getJobId())) {
                log.info("Dropping stale thumbnail retry {} for media {}", message.getJobId(), message.getMediaId());
                return;
            }
            ThumbnailGenerationService.GenerationOutcome outcome = generationService.generate(message.getMediaId(), message.isForce());
            log.debug("Thumbnail job for media {} finished: {}", message.getMediaId(), outcome);
        } catch (Exception e) {
            log.error("Thumbnail job for media {} failed", message.getMediaId(), e);
        }
    }
}
