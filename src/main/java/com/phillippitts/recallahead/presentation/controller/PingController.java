package com.phillippitts.recallahead.presentation.controller;

import com.phillippitts.recallahead.service.surface.SurfaceRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness endpoint. Reports how many input surfaces are open and logs through the MDC
 * filter, so the requestId column of the log pattern can be checked by eye.
 */
@RestController
class PingController {

    private static final Logger LOG = LogManager.getLogger(PingController.class);

    private final SurfaceRegistry registry;

    PingController(SurfaceRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        int openSurfaces = registry.surfaceIds().size();
        LOG.info("Ping received ({} open surface(s))", openSurfaces);
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "openSurfaces", openSurfaces,
                "timestamp", Instant.now().toString()
        ));
    }
}
