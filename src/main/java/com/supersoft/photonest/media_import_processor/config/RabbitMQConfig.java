package com.supersoft.photonest.media_import_processor.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitMQConfig {

    public static final String IMPORT_EXCHANGE = "picker.import.exchange";
    public static final String IMPORT_ITEMS_QUEUE = "picker.import.items";
    public static final String IMPORT_ITEMS_DLQ = "picker.import.items.dlq";
    public static final String IMPORT_ROUTING_KEY = "item";
    public static final String IMPORT_DLQ_ROUTING_KEY = "dlq";

    public static final String MEDIA_ASSETS_EXCHANGE = "media.assets.exchange";
    public static final String THUMBNAILS_QUEUE = "media.thumbnails";
    public static final String THUMBNAILS_DELAY_QUEUE = "media.thumbnails.delay";
    public static final String PLAYBACK_QUEUE = "media.playback";
    public static final String THUMBNAILS_ROUTING_KEY = "thumbnails";
    public static final String THUMBNAILS_DELAY_ROUTING_KEY = "thumbnails.delay";
    public static final String PLAYBACK_ROUTING_KEY = "playback";

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(jsonMessageConverter());
        return template;
    }

    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(ConnectionFactory connectionFactory) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setMessageConverter(jsonMessageConverter());
        factory.setAcknowledgeMode(AcknowledgeMode.AUTO);
        factory.setDefaultRequeueRejected(false);
        return factory;
    }

    @Bean
    public DirectExchange importExchange() {
        return new DirectExchange(IMPORT_EXCHANGE);
    }

    @Bean
    public Queue importItemsQueue() {
        return QueueBuilder.durable(IMPORT_ITEMS_QUEUE)
                .withArgument("x-dead-letter-exchange", IMPORT_EXCHANGE)
                .withArgument("x-dead-letter-routing-key", IMPORT_DLQ_ROUTING_KEY)
                .build();
    }

    @Bean
    public Queue importItemsDlq() {
        return QueueBuilder.durable(IMPORT_ITEMS_DLQ).build();
    }

    @Bean
    public Binding importItemsBinding() {
        return BindingBuilder.bind(importItemsQueue()).to(importExchange()).with(IMPORT_ROUTING_KEY);
    }

    @Bean
    public Binding importItemsDlqBinding() {
        return BindingBuilder.bind(importItemsDlq()).to(importExchange()).with(IMPORT_DLQ_ROUTING_KEY);
    }

    @Bean
    public DirectExchange mediaAssetsExchange() {
        return new DirectExchange(MEDIA_ASSETS_EXCHANGE);
    }

    @Bean
    public Queue thumbnailsQueue() {
        return QueueBuilder.durable(THUMBNAILS_QUEUE).build();
    }

    /**
     * Holding queue for delayed thumbnail retries: messages carry a per-message TTL and are
     * dead-lettered into the thumbnails queue when it runs out. Nothing consumes it directly.
     */
    @Bean
    public Queue thumbnailsDelayQueue() {
        return QueueBuilder.durable(THUMBNAILS_DELAY_QUEUE)
                .withArgument("x-dead-letter-exchange", MEDIA_ASSETS_EXCHANGE)
                .withArgument("x-dead-letter-routing-key", THUMBNAILS_ROUTING_KEY)
                .build();
    }

    @Bean
    public Queue playbackQueue() {
        return QueueBuilder.durable(PLAYBACK_QUEUE).build();
    }

    @Bean
    public Binding thumbnailsBinding() {
        return BindingBuilder.bind(thumbnailsQueue()).to(mediaAssetsExchange()).with(THUMBNAILS_ROUTING_KEY);
    }

    @Bean
    public Binding thumbnailsDelayBinding() {
        return BindingBuilder.bind(thumbnailsDelayQueue()).to(mediaAssetsExchange()).with(THUMBNAILS_DELAY_ROUTING_KEY);
    }

    @Bean
    public Binding playbackBinding() {
        return BindingBuilder.bind(playbackQueue()).to(mediaAssetsExchange()).with(PLAYBACK_ROUTING_KEY);
    }
}
