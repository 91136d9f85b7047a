package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.config.RabbitMQConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SelectionQueuePublisherImpl implements SelectionQueuePublisher {

    @Autowired
    private RabbitTemplate rabbitTemplate;

    @Override
    public void publish(Long selectionId, Long sessionId) {
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.IMPORT_EXCHANGE, RabbitMQConfig.IMPORT_ROUTING_KEY,
                    new SelectionMessage(selectionId, sessionId));
            log.debug("Published selection {} of session {}", selectionId, sessionId);
        } catch (Exception e) {
            log.error("Failed to publish selection {} of session {}", selectionId, sessionId, e);
            throw new IllegalStateException("Failed to publish selection " + selectionId, e);
        }
    }
}
