package com.phillippitts.recallahead.service.surface;

import com.phillippitts.recallahead.exception.SurfaceNotFoundException;
import com.phillippitts.recallahead.service.eventloop.EventLoop;
import com.phillippitts.recallahead.service.orchestration.OptionsUpdate;
import com.phillippitts.recallahead.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Owns one {@link InputSurface} per registered text field and marshals every call onto the
 * event loop.
 *
 * <p><b>Thread Safety:</b> All public methods may be called from any thread except the event
 * loop itself. Fire-and-forget operations ({@link #input}, {@link #search}, {@link #cancel},
 * {@link #clearCache}, {@link #close}) return immediately; {@link #snapshot} and
 * {@link #updateOptions} wait for the loop to answer.
 *
 * @since 1.0
 */
@Service
public class SurfaceRegistry {

    private static final Logger LOG = LogManager.getLogger(SurfaceRegistry.class);

    private final Map<String, InputSurface> surfaces = new ConcurrentHashMap<>();
    private final InputSurfaceFactory factory;
    private final EventLoop eventLoop;

    public SurfaceRegistry(InputSurfaceFactory factory, EventLoop eventLoop) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
    }

    /**
     * Registers a surface. Opening an already registered id keeps the existing surface.
     *
     * @return snapshot of the (new or existing) surface
     */
    public SurfaceSnapshot open(String surfaceId, String provider) {
        surfaces.computeIfAbsent(surfaceId, id -> {
            LOG.info("Opening input surface {} (provider={})", id, provider);
            return factory.create(id, provider);
        });
        return snapshot(surfaceId);
    }

    /**
     * Feeds an input-change event through the surface's trigger gate.
     */
    public void input(String surfaceId, String text) {
        InputSurface surface = require(surfaceId);
        LOG.trace("Input on {}: {}", surfaceId, LogSanitizer.preview(text));
        eventLoop.execute(() -> surface.gate().offer(text));
    }

    /**
     * Explicit search (Enter key, button): bypasses debounce.
     *
     * @param text text to search, or null for the surface's latest text
     */
    public void search(String surfaceId, String text) {
        InputSurface surface = require(surfaceId);
        eventLoop.execute(() -> surface.orchestrator().runImmediate(text));
    }

    public void cancel(String surfaceId) {
        InputSurface surface = require(surfaceId);
        eventLoop.execute(() -> surface.orchestrator().cancel());
    }

    public void clearCache(String surfaceId) {
        InputSurface surface = require(surfaceId);
        eventLoop.execute(() -> surface.orchestrator().clearCache());
    }

    public SurfaceSnapshot snapshot(String surfaceId) {
        InputSurface surface = require(surfaceId);
        return onLoop(surface, SurfaceRegistry::snapshotOf);
    }

    public SurfaceSnapshot updateOptions(String surfaceId, OptionsUpdate update) {
        InputSurface surface = require(surfaceId);
        return onLoop(surface, s -> {
            s.orchestrator().setOptions(update);
            return snapshotOf(s);
        });
    }

    /**
     * Unregisters a surface and cancels its pending work. The surface publishes no further
     * events, including the finish event of a lookup that completes after closing.
     *
     * @return {@code true} if the surface existed
     */
    public boolean close(String surfaceId) {
        InputSurface surface = surfaces.remove(surfaceId);
        if (surface == null) {
            return false;
        }
        LOG.info("Closing input surface {}", surfaceId);
        eventLoop.execute(() -> {
            surface.callbacks().detach();
            surface.orchestrator().cancel();
        });
        return true;
    }

    public Set<String> surfaceIds() {
        return Set.copyOf(surfaces.keySet());
    }

    @PreDestroy
    public void shutdown() {
        for (String surfaceId : surfaceIds()) {
            close(surfaceId);
        }
    }

    private InputSurface require(String surfaceId) {
        InputSurface surface = surfaces.get(surfaceId);
        if (surface == null) {
            throw new SurfaceNotFoundException(surfaceId);
        }
        return surface;
    }

    private <R> R onLoop(InputSurface surface, Function<InputSurface, R> action) {
        return CompletableFuture.supplyAsync(() -> action.apply(surface), eventLoop).join();
    }

    private static SurfaceSnapshot snapshotOf(InputSurface surface) {
        return new SurfaceSnapshot(surface.surfaceId(), surface.provider(),
                surface.orchestrator().getState(), surface.orchestrator().getOptions());
    }
}
