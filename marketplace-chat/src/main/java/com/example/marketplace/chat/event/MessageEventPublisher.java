package com.example.marketplace.chat.event;

import com.example.marketplace.chat.config.ChatProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget publication of {@link MessageEvent}s. A broker outage is logged and never
 * reaches the chat flow that raised the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageEventPublisher {

    private final KafkaTemplate<String, MessageEvent> messageEventKafkaTemplate;
    private final ChatProperties chatProperties;

    public void publish(MessageEvent event) {
        if (!chatProperties.getKafka().isEnabled()) {
            return;
        }
        String topic = chatProperties.getKafka().getMessageTopic();
        String key = MessageEvent.conversationKey(event.getSenderId(), event.getReceiverId());
        try {
            messageEventKafkaTemplate.send(topic, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} event {} to {}", event.getType(), event.getEventId(), topic, ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} event {} to {}", event.getType(), event.getEventId(), topic, ex);
        }
    }
}
