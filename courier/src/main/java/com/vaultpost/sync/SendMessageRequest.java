package com.vaultpost.sync;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Body of {@code POST /api/conversations/{id}/messages}. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SendMessageRequest(String content, String contentType, String queueId, List<String> attachments) {
}
