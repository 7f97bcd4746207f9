package com.contact.resolution.mcp;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.core.Futures;
import com.contact.resolution.core.model.ContactHandles;
import com.contact.resolution.core.model.ContactSummary;
import com.contact.resolution.enrichment.DisplayNames;
import com.contact.resolution.mcp.request.ReadMailRequest;
import com.contact.resolution.pim.MailMessage;
import com.contact.resolution.pim.MailQuery;
import com.contact.resolution.pim.MailReader;
import com.contact.resolution.rules.HandleNormalizer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code mail} tool: reads a message by id, or lists the inbox, a
 * mailbox or search results. Senders and recipients are shown by contact
 * name when known.
 */
public final class MailTools {

    static final String TOOL_NAME = "mail";
    static final int MAX_ENRICHED_HANDLES = 20;
    static final Duration ENRICHMENT_TIMEOUT = Duration.ofSeconds(5);
    static final String ENRICHMENT_LABEL = "mail_enrichment";

    private final MailReader reader;
    private final ContactResolver resolver;
    private final ToolExecution execution;

    public MailTools(MailReader reader, ContactResolver resolver, ToolExecution execution) {
        this.reader = Objects.requireNonNull(reader, "reader is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.execution = Objects.requireNonNull(execution, "execution is required");
    }

    public McpToolDefinition definition() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "id", Map.of("type", "string", "description", "Message id; returns the full message"),
                        "search", Map.of("type", "string", "description", "Text to match in subject or sender"),
                        "mailbox", Map.of("type", "string", "description", "Mailbox name, default Inbox"),
                        "account", Map.of("type", "string", "description", "Account owning the mailbox"),
                        "contact", Map.of("type", "string", "description", "Only mail from this person (by name)"),
                        "enrichContacts", Map.of("type", "boolean", "default", true,
                                "description", "Show senders by contact name"),
                        "limit", Map.of("type", "integer", "minimum", 1, "maximum", ToolInputs.MAX_LIMIT,
                                "default", ToolInputs.DEFAULT_LIMIT),
                        "offset", Map.of("type", "integer", "minimum", 0, "default", 0)
                )
        );
        return new McpToolDefinition(
                TOOL_NAME,
                "Read mail: a single message by id, or a page of the inbox, a mailbox or search results. "
                        + "Use 'contact' to list mail from a person by name.",
                schema,
                params -> execution.run(TOOL_NAME, "read", "read mail", () -> read(params))
        );
    }

    private Map<String, Object> read(Map<String, Object> params) {
        ReadMailRequest request = ReadMailRequest.from(params);
        if (request.id() != null) {
            return readOne(request);
        }

        Set<String> senderHandles = null;
        if (request.hasContactFilter()) {
            Optional<ContactHandles> handles = Futures.join(resolver.resolveNameToHandles(request.contact()));
            if (handles.isEmpty()) {
                return Map.of("count", 0, "messages", List.of(),
                        "message", "No contact found matching '" + request.contact() + "'.");
            }
            senderHandles = new LinkedHashSet<>(handles.get().emails());
            senderHandles.addAll(handles.get().phones());
        }

        List<MailMessage> messages = Futures.join(reader.findMessages(new MailQuery(
                request.mailbox(), request.account(), request.search(), request.limit(), request.offset())));
        if (senderHandles != null) {
            Set<String> wanted = senderHandles;
            messages = messages.stream()
                    .filter(m -> wanted.contains(HandleNormalizer.normalize(MailAddress.parse(m.sender()).address())))
                    .toList();
        }

        Map<String, ContactSummary> names = Map.of();
        if (request.enrichContacts()) {
            List<String> senders = messages.stream()
                    .map(m -> MailAddress.parse(m.sender()).address())
                    .toList();
            names = resolver.enricher().resolveNamesNow(senders, MAX_ENRICHED_HANDLES,
                    ENRICHMENT_TIMEOUT, ENRICHMENT_LABEL);
        }
        Map<String, ContactSummary> resolved = names;
        List<Map<String, Object>> rows = messages.stream()
                .map(m -> summaryRow(m, resolved))
                .toList();
        return ResultMaps.of(
                "count", rows.size(),
                "offset", request.offset(),
                "limit", request.limit(),
                "messages", rows,
                "message", rows.isEmpty() ? "No mail found." : null);
    }

    private Map<String, Object> readOne(ReadMailRequest request) {
        Optional<MailMessage> found = Futures.join(reader.findMessageById(request.id()));
        if (found.isEmpty()) {
            return Map.of("found", false, "message", "Mail message not found: " + request.id());
        }
        MailMessage message = found.get();

        Map<String, ContactSummary> names = Map.of();
        if (request.enrichContacts()) {
            List<String> addresses = new ArrayList<>();
            addresses.add(MailAddress.parse(message.sender()).address());
            message.toRecipients().forEach(r -> addresses.add(MailAddress.parse(r).address()));
            message.ccRecipients().forEach(r -> addresses.add(MailAddress.parse(r).address()));
            names = resolver.enricher().resolveNamesNow(addresses, MAX_ENRICHED_HANDLES,
                    ENRICHMENT_TIMEOUT, ENRICHMENT_LABEL);
        }

        Map<String, Object> row = summaryRow(message, names);
        Map<String, ContactSummary> resolved = names;
        row.put("to", message.toRecipients().stream().map(r -> render(r, resolved)).toList());
        if (!message.ccRecipients().isEmpty()) {
            row.put("cc", message.ccRecipients().stream().map(r -> render(r, resolved)).toList());
        }
        if (message.content() != null) {
            row.put("content", message.content());
        }
        return Map.of("found", true, "message", row);
    }

    private static Map<String, Object> summaryRow(MailMessage message, Map<String, ContactSummary> names) {
        return ResultMaps.of(
                "id", message.id(),
                "subject", message.subject(),
                "from", render(message.sender(), names),
                "senderAddress", MailAddress.parse(message.sender()).address(),
                "dateReceived", message.dateReceived(),
                "read", message.read(),
                "mailbox", message.mailbox(),
                "account", message.account(),
                "preview", message.preview());
    }

    private static String render(String header, Map<String, ContactSummary> names) {
        MailAddress address = MailAddress.parse(header);
        return DisplayNames.fromLookup(names, address.displayName(), address.address());
    }
}
