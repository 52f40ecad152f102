package games.nertz.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logging handle injected into every engine component at construction.
 *
 * <p>Wraps an SLF4J {@link Logger} together with the engine's configured verbosity. INFO and
 * WARN events always reach the logger; DEBUG events are emitted only when the handle is verbose
 * and the underlying logger has DEBUG enabled. Components call {@link #forComponent(Class)} so
 * that each one logs under its own category while sharing the same verbosity.</p>
 */
public final class EngineLog {
    private final Logger log;
    private final boolean verbose;

    public EngineLog(Logger log, boolean verbose) {
        this.log = log;
        this.verbose = verbose;
    }

    /**
     * Creates a handle logging under {@code owner}'s category.
     */
    public static EngineLog of(Class<?> owner, boolean verbose) {
        return new EngineLog(LoggerFactory.getLogger(owner), verbose);
    }

    /**
     * Returns a handle with the same verbosity that logs under {@code component}'s category.
     */
    public EngineLog forComponent(Class<?> component) {
        return new EngineLog(LoggerFactory.getLogger(component), verbose);
    }

    /**
     * Return true if DEBUG events from this handle would be written.
     */
    public boolean isDebugEnabled() {
        return verbose && log.isDebugEnabled();
    }

    public void info(String format, Object... args) {
        if (log.isInfoEnabled()) {
            log.info(format, args);
        }
    }

    public void debug(String format, Object... args) {
        if (isDebugEnabled()) {
            log.debug(format, args);
        }
    }

    public void warn(String format, Object... args) {
        log.warn(format, args);
    }
}
