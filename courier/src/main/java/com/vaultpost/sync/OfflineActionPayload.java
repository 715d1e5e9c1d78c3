package com.vaultpost.sync;

/**
 * A user action replayed against the server once connectivity returns.
 * The set of kinds is closed; each kind carries only the fields its request needs.
 */
public sealed interface OfflineActionPayload
        permits OfflineActionPayload.MarkRead, OfflineActionPayload.DeleteMessage,
        OfflineActionPayload.LeaveConversation {

    ActionType type();

    record MarkRead(String conversationId) implements OfflineActionPayload {
        @Override
        public ActionType type() {
            return ActionType.MARK_READ;
        }
    }

    record DeleteMessage(String messageId) implements OfflineActionPayload {
        @Override
        public ActionType type() {
            return ActionType.DELETE_MESSAGE;
        }
    }

    record LeaveConversation(String conversationId) implements OfflineActionPayload {
        @Override
        public ActionType type() {
            return ActionType.LEAVE_CONVERSATION;
        }
    }
}
