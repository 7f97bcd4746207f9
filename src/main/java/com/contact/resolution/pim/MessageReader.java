package com.contact.resolution.pim;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to the messages store.
 */
public interface MessageReader {

    CompletableFuture<List<ChatSummary>> listChats(MessageQuery query);

    CompletableFuture<List<ChatMessage>> readChat(MessageQuery query);

    CompletableFuture<List<ChatMessage>> searchMessages(MessageQuery query);
}
