package com.example.marketplace.chat.config;

import com.example.marketplace.chat.event.MessageEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, MessageEvent> messageEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, MessageEvent> messageEventKafkaTemplate(
            ProducerFactory<String, MessageEvent> messageEventProducerFactory) {
        return new KafkaTemplate<>(messageEventProducerFactory);
    }

    @Bean
    public NewTopic messageTopic(ChatProperties chatProperties) {
        return TopicBuilder.name(chatProperties.getKafka().getMessageTopic())
                .partitions(12)
                .replicas(1)
                .build();
    }
}
