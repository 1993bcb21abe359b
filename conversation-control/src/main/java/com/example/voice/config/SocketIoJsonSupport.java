package com.example.voice.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Socket.IO frames go out with the same date handling as the REST and SSE surfaces, so a
 * dashboard parses {@code timestamp} identically whichever transport it uses.
 */
public class SocketIoJsonSupport extends JacksonJsonSupport {

    public SocketIoJsonSupport(ObjectMapper sharedMapper) {
        super(new JavaTimeModule());

        this.objectMapper.configure(
                SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                sharedMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        this.objectMapper.configure(
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                sharedMapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        this.objectMapper.setTimeZone(sharedMapper.getSerializationConfig().getTimeZone());
        this.objectMapper.setSerializationInclusion(
                sharedMapper.getSerializationConfig().getDefaultPropertyInclusion().getValueInclusion());
    }
}
