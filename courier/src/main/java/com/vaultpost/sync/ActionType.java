package com.vaultpost.sync;

import java.util.Optional;

/** Stored type tags of the offline action kinds. */
public enum ActionType {
    MARK_READ("mark_read", OfflineActionPayload.MarkRead.class),
    DELETE_MESSAGE("delete_message", OfflineActionPayload.DeleteMessage.class),
    LEAVE_CONVERSATION("leave_conversation", OfflineActionPayload.LeaveConversation.class);

    private final String tag;
    private final Class<? extends OfflineActionPayload> payloadType;

    ActionType(String tag, Class<? extends OfflineActionPayload> payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    public String tag() {
        return tag;
    }

    public Class<? extends OfflineActionPayload> payloadType() {
        return payloadType;
    }

    public static Optional<ActionType> fromTag(String tag) {
        for (ActionType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
