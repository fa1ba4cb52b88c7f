package com.lbg.markets.surveillance.docsync.cli;

import com.lbg.markets.surveillance.docsync.log.InMemoryDocumentNode;
import com.lbg.markets.surveillance.docsync.orchestration.SessionRegistry;
import com.lbg.markets.surveillance.docsync.store.InMemoryContentStore;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class ShellTest {

    @Inject
    @TopCommand
    Shell shell;

    @Inject
    SessionRegistry registry;

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setup() throws IOException {
        registry.openAll(new InMemoryDocumentNode("node-a", new InMemoryContentStore()), Map.of());
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @AfterEach
    void cleanup() {
        registry.closeAll();
    }

    @Test
    void shouldExitOnQuitAndExit() {
        assertFalse(shell.dispatch("quit", out));
        assertFalse(shell.dispatch("  exit ", out));
        assertTrue(output().contains("Goodbye!"));
    }

    @Test
    void shouldIgnoreBlankLines() {
        assertTrue(shell.dispatch("   ", out));
        assertEquals("", output());
    }

    @Test
    void shouldListCommandsOnHelp() {
        assertTrue(shell.dispatch("help", out));

        String text = output();
        assertTrue(text.startsWith("Available commands:"));
        assertTrue(text.contains("add_folder"));
        assertTrue(text.contains("status"));
    }

    @Test
    void shouldAddAndCountFolders() {
        shell.dispatch("get_folder", out);
        shell.dispatch("add_folder", out);
        shell.dispatch("get_folder", out);

        String text = output();
        assertTrue(text.contains("Retrieved folders len: 9"), text);
        assertTrue(text.contains("Folder added."), text);
        assertTrue(text.contains("Retrieved folders len: 10"), text);
    }

    @Test
    void shouldCountResources() {
        shell.dispatch("get", out);

        assertTrue(output().contains("Retrieved resources len: 0"));
    }

    @Test
    void shouldPrintOneStatusLinePerDataset() {
        shell.dispatch("status", out);

        String[] lines = output().split("\\R");
        assertEquals(6, lines.length);
        assertTrue(lines[0].startsWith("resource"));
        assertTrue(lines[1].startsWith("folder"));
        assertTrue(lines[1].contains("pending 0/0 items"), lines[1]);
    }

    @Test
    void shouldPrintTickets() {
        shell.dispatch("tickets", out);

        assertEquals(registry.ticketString(), output().trim());
    }

    @Test
    void shouldReportFailedCommandAndKeepRunning() {
        assertTrue(shell.dispatch("add", out));

        assertTrue(output().startsWith("! add failed: "), output());
    }

    @Test
    void shouldReportUnknownCommand() {
        assertTrue(shell.dispatch("frobnicate", out));

        assertTrue(output().contains("Unknown command: 'frobnicate'"));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
