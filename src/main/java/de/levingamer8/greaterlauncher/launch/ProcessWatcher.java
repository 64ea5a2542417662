package de.levingamer8.greaterlauncher.launch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts one game process at a time and reports its output and exit to listeners.
 * Output lines are passed through as they are; nothing here interprets them.
 */
public final class ProcessWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessWatcher.class);

    public interface Listener {
        default void onStarted(Process process, Instant startedAt) {}
        default void onOutput(String line) {}
        default void onExited(Process process, Instant startedAt, Instant endedAt, int exitCode) {}
    }

    @FunctionalInterface
    public interface ProcessStarter {
        Process start(ProcessBuilder pb) throws IOException;
    }

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ProcessStarter starter;

    private volatile Process process;

    public ProcessWatcher() {
        this(ProcessBuilder::start);
    }

    public ProcessWatcher(ProcessStarter starter) {
        this.starter = Objects.requireNonNull(starter);
    }

    public void addListener(Listener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    public void removeListener(Listener l) {
        listeners.remove(l);
    }

    public boolean isRunning() {
        Process p = this.process;
        return running.get() && p != null && p.isAlive();
    }

    public synchronized Process start(ProcessBuilder pb) throws IOException {
        if (running.get()) throw new IllegalStateException("ProcessWatcher: already running");

        Process p = starter.start(pb);
        Instant start = Instant.now();

        this.process = p;
        running.set(true);

        for (Listener l : listeners) {
            try { l.onStarted(p, start); } catch (RuntimeException e) { LOG.warn("Listener failed in onStarted", e); }
        }

        Thread t = new Thread(() -> watch(p, start), "process-watcher");
        t.setDaemon(true);
        t.start();

        return p;
    }

    private void watch(Process p, Instant start) {
        int code = -1;
        try {
            pump(p);
            code = p.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!p.isAlive()) code = p.exitValue();
        } finally {
            Instant end = Instant.now();
            running.set(false);
            LOG.info("Game process exited with code {}", code);

            for (Listener l : listeners) {
                try { l.onExited(p, start, end, code); } catch (RuntimeException e) { LOG.warn("Listener failed in onExited", e); }
            }

            synchronized (this) {
                if (this.process == p) this.process = null;
            }
        }
    }

    private void pump(Process p) {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                for (Listener l : listeners) {
                    try { l.onOutput(line); } catch (RuntimeException e) { LOG.warn("Listener failed in onOutput", e); }
                }
            }
        } catch (IOException e) {
            LOG.debug("Output reader ended: {}", e.getMessage());
        }
    }
}
