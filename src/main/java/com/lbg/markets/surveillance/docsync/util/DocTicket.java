package com.lbg.markets.surveillance.docsync.util;

/**
 * Invitation to join a dataset document, in text form {@code docticket:<namespace>@<node>}.
 */
public record DocTicket(String namespaceId, String nodeId) {

    private static final String PREFIX = "docticket:";

    public DocTicket {
        if (namespaceId == null || namespaceId.isBlank()) {
            throw new IllegalArgumentException("namespaceId cannot be blank");
        }
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId cannot be blank");
        }
    }

    public static DocTicket parse(String text) {
        if (text == null || !text.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not a document ticket: " + text);
        }
        String body = text.substring(PREFIX.length());
        int at = body.indexOf('@');
        if (at <= 0 || at == body.length() - 1) {
            throw new IllegalArgumentException("Malformed document ticket: " + text);
        }
        return new DocTicket(body.substring(0, at), body.substring(at + 1));
    }

    @Override
    public String toString() {
        return PREFIX + namespaceId + "@" + nodeId;
    }
}
