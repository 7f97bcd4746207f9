package com.contact.resolution.mcp;

/**
 * A mail header address split into display name and address part.
 * {@code "Jane Smith <jane@example.com>"} parses to name {@code "Jane Smith"}
 * and address {@code "jane@example.com"}; a bare address has no name.
 */
public record MailAddress(String displayName, String address) {

    public static MailAddress parse(String header) {
        if (header == null) {
            return new MailAddress(null, "");
        }
        String value = header.trim();
        int open = value.lastIndexOf('<');
        int close = value.lastIndexOf('>');
        if (open >= 0 && close > open) {
            String address = value.substring(open + 1, close).trim();
            String name = stripQuotes(value.substring(0, open).trim());
            return new MailAddress(name.isEmpty() ? null : name, address);
        }
        return new MailAddress(null, value);
    }

    private static String stripQuotes(String name) {
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            return name.substring(1, name.length() - 1).trim();
        }
        return name;
    }
}
