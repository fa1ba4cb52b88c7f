package com.lbg.markets.surveillance.docsync.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocTicketTest {

    @Test
    void shouldParseTextForm() {
        DocTicket ticket = DocTicket.parse("docticket:ns-1@node-a");

        assertEquals("ns-1", ticket.namespaceId());
        assertEquals("node-a", ticket.nodeId());
        assertEquals("docticket:ns-1@node-a", ticket.toString());
    }

    @Test
    void shouldRejectMalformedTickets() {
        assertThrows(IllegalArgumentException.class, () -> DocTicket.parse(null));
        assertThrows(IllegalArgumentException.class, () -> DocTicket.parse("ticket:ns@node"));
        assertThrows(IllegalArgumentException.class, () -> DocTicket.parse("docticket:@node"));
        assertThrows(IllegalArgumentException.class, () -> DocTicket.parse("docticket:ns@"));
        assertThrows(IllegalArgumentException.class, () -> DocTicket.parse("docticket:ns"));
    }
}
