package com.vaultpost.store;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Stores attachment lists as a JSON array column. */
@Component
public class AttachmentCodec {

    private static final Logger log = LoggerFactory.getLogger(AttachmentCodec.class);
    private static final TypeReference<List<String>> LIST_OF_STRINGS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public AttachmentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String encode(List<String> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(attachments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode attachment list", e);
        }
    }

    List<String> decode(String column) {
        if (column == null || column.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(column, LIST_OF_STRINGS);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable attachment column: {}", e.getOriginalMessage());
            return List.of();
        }
    }
}
