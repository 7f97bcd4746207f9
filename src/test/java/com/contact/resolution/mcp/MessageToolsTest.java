package com.contact.resolution.mcp;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.pim.ChatMessage;
import com.contact.resolution.pim.ChatSummary;
import com.contact.resolution.pim.MessageQuery;
import com.contact.resolution.pim.MessageReader;
import com.contact.resolution.source.ScriptedIdentitySource;
import com.contact.resolution.source.TestContacts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageTools Tests")
class MessageToolsTest {

    @Mock
    private MessageReader reader;

    private ScriptedIdentitySource source;
    private ContactResolver resolver;
    private McpToolDefinition tool;

    @BeforeEach
    void setUp() {
        source = new ScriptedIdentitySource(TestContacts.all());
        resolver = ContactResolver.builder().identitySource(source).build();
        tool = new MessageTools(reader, resolver, new ToolExecution(new NoOpMetricsService())).definition();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> rows(Map<String, Object> result, String key) {
        return (List<Map<String, Object>>) result.get(key);
    }

    @Test
    @DisplayName("Chats named after raw handles get participant names")
    void chatNames() {
        ChatSummary unnamed = new ChatSummary("chat-1", "+15551234567, +12125551234",
                List.of("+15551234567", "+12125551234"), "hi", "2024-03-01");
        ChatSummary named = new ChatSummary("chat-2", "Family", List.of("+447700900123"), "dinner?", "2024-03-02");
        when(reader.listChats(any())).thenReturn(CompletableFuture.completedFuture(List.of(unnamed, named)));

        List<Map<String, Object>> chats = rows(tool.call(Map.of()), "chats");

        assertEquals("John Doe, Bob Wilson", chats.get(0).get("name"));
        assertEquals(List.of("John Doe", "Bob Wilson"), chats.get(0).get("participants"));
        assertEquals("Family", chats.get(1).get("name"));
        assertEquals(List.of("+447700900123"), chats.get(1).get("participants"));
    }

    @Test
    @DisplayName("Chat messages show senders by name, placeholders untouched")
    void readChat() {
        when(reader.readChat(any())).thenReturn(CompletableFuture.completedFuture(List.of(
                new ChatMessage("1", "chat-1", "hello", null, "2024-03-01", true),
                new ChatMessage("2", "chat-1", "hi back", "+44 20 7946 0958", "2024-03-01", false),
                new ChatMessage("3", "chat-1", "who?", "unknown", "2024-03-01", false))));

        Map<String, Object> result = tool.call(Map.of("chatId", "chat-1"));

        List<Map<String, Object>> messages = rows(result, "messages");
        assertEquals("me", messages.get(0).get("from"));
        assertEquals("Jane Smith", messages.get(1).get("from"));
        assertEquals("unknown", messages.get(2).get("from"));

        ArgumentCaptor<MessageQuery> query = ArgumentCaptor.forClass(MessageQuery.class);
        verify(reader).readChat(query.capture());
        assertEquals("chat-1", query.getValue().chatId());
    }

    @Test
    @DisplayName("Contact filter searches messages from the person's handles")
    void contactFilter() {
        source.searchReturns(List.of(TestContacts.BOB));
        when(reader.searchMessages(any())).thenReturn(CompletableFuture.completedFuture(List.of(
                new ChatMessage("7", "chat-3", "lunch?", "+12125551234", "2024-03-03", false))));

        Map<String, Object> result = tool.call(Map.of("contact", "Bob"));

        assertEquals("Bob Wilson", rows(result, "messages").get(0).get("from"));
        ArgumentCaptor<MessageQuery> query = ArgumentCaptor.forClass(MessageQuery.class);
        verify(reader).searchMessages(query.capture());
        assertEquals(Set.of("12125551234"), query.getValue().senderHandles());
    }

    @Test
    @DisplayName("Unknown person short-circuits with a message")
    void unknownContact() {
        Map<String, Object> result = tool.call(Map.of("contact", "Nobody"));

        assertEquals("No contact found matching 'Nobody'.", result.get("message"));
        verify(reader, never()).searchMessages(any());
    }

    @Test
    @DisplayName("Search without searchMessages looks at chats")
    void searchChats() {
        when(reader.listChats(any())).thenReturn(CompletableFuture.completedFuture(List.of()));

        Map<String, Object> result = tool.call(Map.of("search", "Family"));

        assertEquals("No chats found.", result.get("message"));
        verify(reader, never()).searchMessages(any());
    }

    @Test
    @DisplayName("Search with searchMessages looks at message text")
    void searchText() {
        when(reader.searchMessages(any())).thenReturn(CompletableFuture.completedFuture(List.of()));

        Map<String, Object> result = tool.call(Map.of("search", "dinner", "searchMessages", true));

        assertEquals("No messages found.", result.get("message"));
        verify(reader, never()).listChats(any());
    }

    @Test
    void placeholderSendersAreNotResolvable() {
        assertFalse(MessageTools.hasResolvableSender(new ChatMessage("1", "c", "", "Me", null, false)));
        assertFalse(MessageTools.hasResolvableSender(new ChatMessage("2", "c", "", " ", null, false)));
        assertFalse(MessageTools.hasResolvableSender(new ChatMessage("3", "c", "", "+15551234567", null, true)));
        assertTrue(MessageTools.hasResolvableSender(new ChatMessage("4", "c", "", "+15551234567", null, false)));
    }
}
