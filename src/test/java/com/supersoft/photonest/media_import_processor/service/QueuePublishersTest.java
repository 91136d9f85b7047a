package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.config.RabbitMQConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueuePublishersTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    private SelectionQueuePublisherImpl selectionPublisher;
    private AssetGenerationPublisherImpl assetPublisher;

    @BeforeEach
    void setUp() {
        selectionPublisher = new SelectionQueuePublisherImpl();
        ReflectionTestUtils.setField(selectionPublisher, "rabbitTemplate", rabbitTemplate);
        assetPublisher = new AssetGenerationPublisherImpl();
        ReflectionTestUtils.setField(assetPublisher, "rabbitTemplate", rabbitTemplate);
    }

    @Test
    void testSelectionPublishedToImportExchange() {
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);

        selectionPublisher.publish(11L, 7L);

        verify(rabbitTemplate).convertAndSend(eq(RabbitMQConfig.IMPORT_EXCHANGE), eq(RabbitMQConfig.IMPORT_ROUTING_KEY), payload.capture());
        SelectionQueuePublisher.SelectionMessage message = (SelectionQueuePublisher.SelectionMessage) payload.getValue();
        assertEquals(11L, message.getSelectionId());
        assertEquals(7L, message.getSessionId());
    }

    @Test
    void testSelectionPublishFailureIsRaised() {
        doThrow(new AmqpConnectException(new ConnectException("broker down")))
                .when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class));

        assertThrows(IllegalStateException.class, () -> selectionPublisher.publish(11L, 7L));
    }

    @Test
    void testThumbnailAndPlaybackRouting() {
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);

        assetPublisher.requestThumbnails(42L, false);
        assetPublisher.requestPlayback(42L);

        verify(rabbitTemplate).convertAndSend(eq(RabbitMQConfig.MEDIA_ASSETS_EXCHANGE), eq(RabbitMQConfig.THUMBNAILS_ROUTING_KEY), payload.capture());
        AssetGenerationPublisher.ThumbnailJobMessage thumbnail = (AssetGenerationPublisher.ThumbnailJobMessage) payload.getValue();
        assertNull(thumbnail.getJobId());
        verify(rabbitTemplate).convertAndSend(eq(RabbitMQConfig.MEDIA_ASSETS_EXCHANGE), eq(RabbitMQConfig.PLAYBACK_ROUTING_KEY),
                any(AssetGenerationPublisher.PlaybackJobMessage.class));
    }
}
