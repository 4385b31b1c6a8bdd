package org.postevent.cdp;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BrowserProcessTest {

    @Test
    public void testSingleQuote() {
        assertEquals("'chromium'", BrowserProcess.singleQuote("chromium"));
        assertEquals("'--user-data-dir=/tmp/it'\\''s here'", BrowserProcess.singleQuote("--user-data-dir=/tmp/it's here"));
        assertEquals("'$HOME `id`'", BrowserProcess.singleQuote("$HOME `id`"));
    }

    @Test
    public void testBrowserCommand() {
        var command = BrowserProcess.browserCommand("chromium", "--remote-debugging-pipe", Path.of("/tmp/profile"),
                List.of("--headless=new"));
        assertEquals("chromium", command.get(0));
        assertEquals("--remote-debugging-pipe", command.get(1));
        assertTrue(command.contains("--user-data-dir=/tmp/profile"));
        assertEquals("--headless=new", command.get(command.size() - 1));

        var noOptions = BrowserProcess.browserCommand("chromium", "--remote-debugging-port=0", Path.of("/tmp/p"), null);
        assertEquals("--user-data-dir=/tmp/p", noOptions.get(noOptions.size() - 1));
    }

    @Test
    public void testFindExecutable() throws Exception {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        assertEquals(java, BrowserProcess.findExecutable(List.of("no-such-browser-7f3a", java)));
        var e = assertThrows(IOException.class, () -> BrowserProcess.findExecutable(List.of("no-such-browser-7f3a")));
        assertTrue(e.getMessage().startsWith("No browser found"), e.getMessage());
    }
}
