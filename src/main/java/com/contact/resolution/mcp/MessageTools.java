package com.contact.resolution.mcp;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.core.Futures;
import com.contact.resolution.core.model.ContactHandles;
import com.contact.resolution.core.model.ContactSummary;
import com.contact.resolution.enrichment.DisplayNames;
import com.contact.resolution.mcp.request.ReadMessagesRequest;
import com.contact.resolution.pim.ChatMessage;
import com.contact.resolution.pim.ChatSummary;
import com.contact.resolution.pim.MessageQuery;
import com.contact.resolution.pim.MessageReader;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code messages} tool: lists chats, reads a chat, or searches message
 * text. Participants and senders are shown by contact name when known.
 */
public final class MessageTools {

    static final String TOOL_NAME = "messages";
    static final int MAX_ENRICHED_HANDLES = 20;
    static final Duration ENRICHMENT_TIMEOUT = Duration.ofSeconds(5);
    static final String ENRICHMENT_LABEL = "messages_enrichment";

    /** Sender values the store uses when there is no handle to resolve. */
    static final Set<String> SENDER_PLACEHOLDERS = Set.of("me", "unknown");

    private final MessageReader reader;
    private final ContactResolver resolver;
    private final ToolExecution execution;

    public MessageTools(MessageReader reader, ContactResolver resolver, ToolExecution execution) {
        this.reader = Objects.requireNonNull(reader, "reader is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.execution = Objects.requireNonNull(execution, "execution is required");
    }

    public McpToolDefinition definition() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "chatId", Map.of("type", "string", "description", "Read the messages of this chat"),
                        "search", Map.of("type", "string", "description", "Chat name or, with searchMessages, message text"),
                        "searchMessages", Map.of("type", "boolean", "default", false,
                                "description", "Search message text instead of chat names"),
                        "contact", Map.of("type", "string", "description", "Only messages from this person (by name)"),
                        "enrichContacts", Map.of("type", "boolean", "default", true,
                                "description", "Show senders by contact name"),
                        "limit", Map.of("type", "integer", "minimum", 1, "maximum", ToolInputs.MAX_LIMIT,
                                "default", ToolInputs.DEFAULT_LIMIT),
                        "offset", Map.of("type", "integer", "minimum", 0, "default", 0)
                )
        );
        return new McpToolDefinition(
                TOOL_NAME,
                "Read messages: list chats, read one chat, or search message text. "
                        + "Use 'contact' to find messages from a person by name.",
                schema,
                params -> execution.run(TOOL_NAME, "read", "read messages", () -> read(params))
        );
    }

    private Map<String, Object> read(Map<String, Object> params) {
        ReadMessagesRequest request = ReadMessagesRequest.from(params);

        Set<String> senderHandles = Set.of();
        if (request.hasContactFilter()) {
            Optional<ContactHandles> handles = Futures.join(resolver.resolveNameToHandles(request.contact()));
            if (handles.isEmpty()) {
                return Map.of("count", 0, "messages", List.of(),
                        "message", "No contact found matching '" + request.contact() + "'.");
            }
            Set<String> all = new LinkedHashSet<>(handles.get().phones());
            all.addAll(handles.get().emails());
            senderHandles = all;
        }
        MessageQuery query = new MessageQuery(request.chatId(), request.search(), senderHandles,
                request.limit(), request.offset());

        if (request.chatId() != null) {
            return messagesResult(Futures.join(reader.readChat(query)), request);
        }
        if ((request.search() != null && request.searchMessages()) || !senderHandles.isEmpty()) {
            return messagesResult(Futures.join(reader.searchMessages(query)), request);
        }
        return chatsResult(Futures.join(reader.listChats(query)), request);
    }

    private Map<String, Object> messagesResult(List<ChatMessage> messages, ReadMessagesRequest request) {
        Map<String, ContactSummary> names = Map.of();
        if (request.enrichContacts()) {
            List<String> senders = messages.stream()
                    .filter(MessageTools::hasResolvableSender)
                    .map(ChatMessage::sender)
                    .toList();
            names = resolver.enricher().resolveNamesNow(senders, MAX_ENRICHED_HANDLES,
                    ENRICHMENT_TIMEOUT, ENRICHMENT_LABEL);
        }
        Map<String, ContactSummary> resolved = names;
        List<Map<String, Object>> rows = messages.stream()
                .map(m -> ResultMaps.of(
                        "id", m.id(),
                        "chatId", m.chatId(),
                        "from", m.fromMe() ? "me" : DisplayNames.fromLookup(resolved, null, m.sender()),
                        "isFromMe", m.fromMe(),
                        "date", m.date(),
                        "text", m.text()))
                .toList();
        return ResultMaps.of(
                "count", rows.size(),
                "offset", request.offset(),
                "limit", request.limit(),
                "messages", rows,
                "message", rows.isEmpty() ? "No messages found." : null);
    }

    private Map<String, Object> chatsResult(List<ChatSummary> chats, ReadMessagesRequest request) {
        Map<String, ContactSummary> names = Map.of();
        if (request.enrichContacts()) {
            List<String> participants = chats.stream()
                    .flatMap(c -> c.participants().stream())
                    .toList();
            names = resolver.enricher().resolveNamesNow(participants, MAX_ENRICHED_HANDLES,
                    ENRICHMENT_TIMEOUT, ENRICHMENT_LABEL);
        }
        Map<String, ContactSummary> resolved = names;
        List<Map<String, Object>> rows = chats.stream()
                .map(c -> {
                    List<String> people = c.participants().stream()
                            .map(p -> DisplayNames.fromLookup(resolved, null, p))
                            .toList();
                    return ResultMaps.of(
                            "id", c.id(),
                            "name", chatName(c, people),
                            "participants", people,
                            "lastMessage", c.lastMessage(),
                            "lastDate", c.lastDate());
                })
                .toList();
        return ResultMaps.of(
                "count", rows.size(),
                "offset", request.offset(),
                "limit", request.limit(),
                "chats", rows,
                "message", rows.isEmpty() ? "No chats found." : null);
    }

    /**
     * A chat the store named after its raw participant handles gets the
     * resolved participant names instead.
     */
    private static String chatName(ChatSummary chat, List<String> renderedParticipants) {
        String raw = String.join(", ", chat.participants());
        if (chat.name() == null || chat.name().isBlank() || chat.name().equals(raw)
                || "Unknown".equals(chat.name())) {
            return renderedParticipants.isEmpty() ? chat.name() : String.join(", ", renderedParticipants);
        }
        return chat.name();
    }

    static boolean hasResolvableSender(ChatMessage message) {
        if (message.fromMe() || message.sender() == null || message.sender().isBlank()) {
            return false;
        }
        return !SENDER_PLACEHOLDERS.contains(message.sender().trim().toLowerCase(Locale.ROOT));
    }
}
