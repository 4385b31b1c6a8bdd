package org.postevent.cdp;

import org.postevent.cdp.domains.Browser;
import org.postevent.cdp.protocol.CDPClient;
import org.postevent.cdp.protocol.CDPClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.lang.ProcessBuilder.Redirect.INHERIT;
import static java.lang.ProcessBuilder.Redirect.PIPE;
import static java.util.stream.Collectors.joining;

/**
 * Launches and manages a Chromium-family browser controlled over CDP.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 *
 * try (BrowserProcess browser = BrowserProcess.startHeadless(null, null);
 *      Tab tab = browser.newTab()) {
 *     tab.navigateTo("http://example.com/");
 * }
 * }</pre>
 */
public class BrowserProcess implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserProcess.class);
    private static final List<String> BROWSER_EXECUTABLES = List.of(
            "chromium-browser",
            "chromium",
            "google-chrome",
            "google-chrome-stable",
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe");
    private static final List<String> DEFAULT_FLAGS = List.of(
            "--no-default-browser-check",
            "--no-first-run",
            "--no-startup-window",
            "--disable-background-networking",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding",
            "--disable-sync",
            "--use-mock-keychain",
            "--disable-blink-features=AutomationControlled",
            "--window-size=1920,1080");
    private static final String DEVTOOLS_BANNER = "DevTools listening on ";

    private final Process process;
    private final CDPClient cdp;
    private final Browser browser;
    private Browser.Version version;

    private BrowserProcess(Process process, CDPClient cdp) {
        this.process = process;
        this.cdp = cdp;
        this.browser = cdp.domain(Browser.class);
    }

    public static BrowserProcess startHeadless(String executable, Path profileDir) throws IOException {
        return start(executable, List.of("--headless=new", "--disable-gpu"), profileDir, null);
    }

    /**
     * Starts a browser.
     *
     * @param executable browser binary, or null to probe for a well-known one
     * @param options    extra command-line flags
     * @param profileDir user data directory, or null for a temporary one deleted on exit
     * @param shell      command prefix to run the browser through (e.g. {@code ssh host}), or null for
     *                   {@code /bin/sh -c} when available
     */
    public static BrowserProcess start(String executable, List<String> options, Path profileDir,
                                       List<String> shell) throws IOException {
        if (shell == null && Files.exists(Path.of("/bin/sh"))) {
            shell = List.of("/bin/sh", "-c");
        }
        if (executable == null) {
            executable = shell == null ? findLocalExecutable() : findExecutableViaShell(shell);
        }
        Path userDataDir = profileDir != null ? profileDir :
                Path.of(System.getProperty("java.io.tmpdir"), "postevent-" + UUID.randomUUID());
        boolean deleteProfile = profileDir == null;

        Process process;
        if (shell != null) {
            process = launchPiped(shell, browserCommand(executable, "--remote-debugging-pipe", userDataDir, options),
                    deleteProfile ? userDataDir : null);
        } else {
            Files.createDirectories(userDataDir);
            process = new ProcessBuilder(browserCommand(executable, "--remote-debugging-port=0", userDataDir, options))
                    .redirectOutput(INHERIT)
                    .redirectError(PIPE)
                    .start();
        }
        java.lang.Runtime.getRuntime().addShutdownHook(new Thread(() -> reap(process), "browser-reaper"));

        try {
            CDPClient cdp = shell != null ?
                    new CDPClient(process.getInputStream(), process.getOutputStream()) :
                    new CDPClient(awaitDevtoolsUrl(process));
            return new BrowserProcess(process, cdp);
        } catch (IOException | RuntimeException e) {
            process.destroy();
            throw e;
        }
    }

    static List<String> browserCommand(String executable, String debuggingFlag, Path userDataDir,
                                       List<String> options) {
        var command = new ArrayList<String>(DEFAULT_FLAGS.size() + 4);
        command.add(executable);
        command.add(debuggingFlag);
        command.addAll(DEFAULT_FLAGS);
        command.add("--user-data-dir=" + userDataDir);
        if (options != null) command.addAll(options);
        return command;
    }

    /**
     * Runs the browser through {@code shell} with its CDP pipe (fds 3 and 4) connected to our end of
     * the process's stdin and stdout, since ProcessBuilder can only hand a child the standard three.
     *
     * @param deleteOnExit profile directory the shell removes when the browser exits, or null
     */
    private static Process launchPiped(List<String> shell, List<String> command, Path deleteOnExit)
            throws IOException {
        var script = new StringBuilder();
        if (deleteOnExit != null) {
            script.append("trap ")
                    .append(singleQuote("rm -rf " + singleQuote(deleteOnExit.toString()) + " 2>/dev/null"))
                    .append(" EXIT && ");
        }
        script.append(command.stream().map(BrowserProcess::singleQuote).collect(joining(" ")));
        script.append(" 3<&0 4>&1 0<&- 1>&2");

        var shellCommand = new ArrayList<>(shell);
        shellCommand.add(script.toString());
        return new ProcessBuilder(shellCommand)
                .redirectError(INHERIT)
                .redirectOutput(PIPE)
                .redirectInput(PIPE)
                .start();
    }

    /**
     * Gives the browser a second to exit by itself, then asks it to terminate and finally kills it.
     */
    private static void reap(Process process) {
        try {
            if (!process.waitFor(1, TimeUnit.SECONDS)) {
                process.destroy();
                if (!process.waitFor(10, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static String singleQuote(String string) {
        return "'" + string.replace("'", "'\\''") + "'";
    }

    private static String findLocalExecutable() throws IOException {
        return findExecutable(BROWSER_EXECUTABLES);
    }

    /**
     * First candidate that runs with {@code --version}.
     */
    static String findExecutable(List<String> candidates) throws IOException {
        for (var candidate : candidates) {
            Process probe;
            try {
                probe = new ProcessBuilder(candidate, "--version")
                        .redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                        .start();
            } catch (IOException e) {
                log.trace("{} not found", candidate);
                continue;
            }
            try {
                if (!probe.waitFor(10, TimeUnit.SECONDS)) {
                    log.debug("{} --version didn't exit, assuming it's usable", candidate);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted looking for a browser", e);
            } finally {
                probe.destroy();
            }
            return candidate;
        }
        throw new IOException("No browser found in " + candidates + ", set an executable");
    }

    private static String findExecutableViaShell(List<String> shell) throws IOException {
        var command = new ArrayList<>(shell);
        command.add(BROWSER_EXECUTABLES.stream()
                .map(candidate -> "command -v " + singleQuote(candidate))
                .collect(joining(" || ")));
        var process = new ProcessBuilder(command)
                .redirectError(INHERIT)
                .redirectOutput(PIPE)
                .start();
        String found = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted looking for a browser", e);
        }
        if (exitCode != 0 || found.isEmpty()) {
            throw new IOException("No browser found via " + shell + ", set an executable");
        }
        return found.lines().findFirst().orElseThrow();
    }

    /**
     * Scans the browser's stderr for the line announcing its DevTools WebSocket, forwarding
     * everything it prints to the log.
     */
    private static URI awaitDevtoolsUrl(Process process) throws IOException {
        var url = new CompletableFuture<URI>();
        var scanner = new Thread(() -> {
            try (var stderr = new BufferedReader(new InputStreamReader(process.getErrorStream(),
                    StandardCharsets.UTF_8))) {
                String line;
                while ((line = stderr.readLine()) != null) {
                    if (line.startsWith(DEVTOOLS_BANNER)) {
                        url.complete(URI.create(line.substring(DEVTOOLS_BANNER.length()).strip()));
                    }
                    log.info("Browser: {}", line);
                }
                url.completeExceptionally(new IOException("Browser exited without announcing its DevTools URL"));
            } catch (IOException e) {
                log.error("Error reading browser stderr", e);
                url.completeExceptionally(e);
            }
        }, "browser-stderr");
        scanner.setDaemon(true);
        scanner.start();
        try {
            return url.get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for the DevTools URL", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Browser didn't announce a DevTools URL", e);
        }
    }

    /**
     * Opens a new blank tab.
     *
     * @see Tab#open(CDPClient)
     */
    public Tab newTab() {
        return Tab.open(cdp);
    }

    public Browser.Version version() {
        if (version == null) {
            this.version = browser.getVersion();
        }
        return version;
    }

    /**
     * Closes the connection to the browser and terminates the process.
     */
    @Override
    public void close() {
        // ask nicely first
        try {
            browser.close();
            cdp.waitClose(Duration.ofMillis(1000));
        } catch (CDPClosedException e) {
            log.debug("Browser connection already closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Error quitting browser", e);
        }
        try {
            cdp.close();
        } catch (Exception e) {
            log.warn("Error closing browser CDP connection", e);
        }
        process.destroy();
        try {
            process.waitFor(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            log.warn("Interrupted closing process", e);
            Thread.currentThread().interrupt();
        } finally {
            process.destroyForcibly();
        }
    }
}
