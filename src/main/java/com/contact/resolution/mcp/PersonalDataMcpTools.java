package com.contact.resolution.mcp;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.pim.CalendarEventReader;
import com.contact.resolution.pim.ContactWriter;
import com.contact.resolution.pim.MailReader;
import com.contact.resolution.pim.MessageReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the MCP tool definitions over one shared {@link ContactResolver}.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code calendar_events} -- read events, attendees shown by name (needs a calendar reader)</li>
 *   <li>{@code mail} -- read mail, senders and recipients shown by name (needs a mail reader)</li>
 *   <li>{@code messages} -- read chats and messages, senders shown by name (needs a message reader)</li>
 *   <li>{@code contacts} -- search, resolve, create, update, delete (always present)</li>
 * </ul>
 */
public final class PersonalDataMcpTools {

    private final List<McpToolDefinition> definitions;

    private PersonalDataMcpTools(Builder builder) {
        ContactResolver resolver = Objects.requireNonNull(builder.resolver, "resolver is required");
        ToolExecution execution = new ToolExecution(resolver.getMetricsService());

        List<McpToolDefinition> tools = new ArrayList<>();
        if (builder.calendarReader != null) {
            tools.add(new CalendarTools(builder.calendarReader, resolver.enricher(), execution).definition());
        }
        if (builder.mailReader != null) {
            tools.add(new MailTools(builder.mailReader, resolver, execution).definition());
        }
        if (builder.messageReader != null) {
            tools.add(new MessageTools(builder.messageReader, resolver, execution).definition());
        }
        tools.add(new ContactTools(resolver, builder.contactWriter, execution).definition());
        this.definitions = List.copyOf(tools);
    }

    public List<McpToolDefinition> getToolDefinitions() {
        return definitions;
    }

    public Optional<McpToolDefinition> getTool(String name) {
        return definitions.stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    public static Builder builder(ContactResolver resolver) {
        return new Builder(resolver);
    }

    public static final class Builder {
        private final ContactResolver resolver;
        private CalendarEventReader calendarReader;
        private MailReader mailReader;
        private MessageReader messageReader;
        private ContactWriter contactWriter;

        private Builder(ContactResolver resolver) {
            this.resolver = resolver;
        }

        public Builder calendarReader(CalendarEventReader calendarReader) {
            this.calendarReader = calendarReader;
            return this;
        }

        public Builder mailReader(MailReader mailReader) {
            this.mailReader = mailReader;
            return this;
        }

        public Builder messageReader(MessageReader messageReader) {
            this.messageReader = messageReader;
            return this;
        }

        public Builder contactWriter(ContactWriter contactWriter) {
            this.contactWriter = contactWriter;
            return this;
        }

        public PersonalDataMcpTools build() {
            return new PersonalDataMcpTools(this);
        }
    }
}
