package com.example.marketplace.chat.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Lines the Socket.IO codec up with the Spring {@link ObjectMapper}, so that chat payloads carry
 * ISO-8601 timestamps and tolerate extra fields sent by browser clients.
 */
public class SpringJacksonJsonSupport extends JacksonJsonSupport {

    public SpringJacksonJsonSupport(ObjectMapper baseMapper) {
        super(new JavaTimeModule());

        if (!baseMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)) {
            this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.objectMapper.setTimeZone(baseMapper.getSerializationConfig().getTimeZone());
        this.objectMapper.setDefaultPropertyInclusion(
                baseMapper.getSerializationConfig().getDefaultPropertyInclusion());
    }
}
