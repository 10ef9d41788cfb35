package com.phillippitts.recallahead.presentation.controller;

import com.phillippitts.recallahead.presentation.dto.SurfaceView;
import com.phillippitts.recallahead.presentation.dto.TextRequest;
import com.phillippitts.recallahead.service.orchestration.OptionsUpdate;
import com.phillippitts.recallahead.service.surface.SurfaceRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * REST boundary for input surfaces. Input, search and cancel are accepted asynchronously;
 * results are delivered through application events and visible via {@code GET}.
 */
@RestController
@RequestMapping("/api/surfaces")
class SurfaceController {

    private final SurfaceRegistry registry;

    SurfaceController(SurfaceRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    Set<String> list() {
        return registry.surfaceIds();
    }

    @PutMapping("/{surfaceId}")
    SurfaceView open(@PathVariable String surfaceId,
                     @RequestParam(required = false) String provider) {
        return SurfaceView.from(registry.open(surfaceId, provider));
    }

    @GetMapping("/{surfaceId}")
    SurfaceView get(@PathVariable String surfaceId) {
        return SurfaceView.from(registry.snapshot(surfaceId));
    }

    @PostMapping("/{surfaceId}/input")
    ResponseEntity<Void> input(@PathVariable String surfaceId, @RequestBody TextRequest request) {
        registry.input(surfaceId, request.text());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{surfaceId}/search")
    ResponseEntity<Void> search(@PathVariable String surfaceId,
                                @RequestBody(required = false) TextRequest request) {
        registry.search(surfaceId, request == null ? null : request.text());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{surfaceId}/cancel")
    ResponseEntity<Void> cancel(@PathVariable String surfaceId) {
        registry.cancel(surfaceId);
        return ResponseEntity.accepted().build();
    }

    @PatchMapping("/{surfaceId}/options")
    SurfaceView updateOptions(@PathVariable String surfaceId, @RequestBody OptionsUpdate update) {
        return SurfaceView.from(registry.updateOptions(surfaceId, update));
    }

    @DeleteMapping("/{surfaceId}/cache")
    ResponseEntity<Void> clearCache(@PathVariable String surfaceId) {
        registry.clearCache(surfaceId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{surfaceId}")
    ResponseEntity<Void> close(@PathVariable String surfaceId) {
        return registry.close(surfaceId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
