package com.incoresoft.presenceTracker.web;

import com.incoresoft.presenceTracker.domain.identity.dto.IdentityListResponse;
import com.incoresoft.presenceTracker.domain.identity.dto.IdentitySummary;
import com.incoresoft.presenceTracker.domain.identity.service.IdentityService;
import com.incoresoft.presenceTracker.domain.session.dto.PresenceSnapshot;
import com.incoresoft.presenceTracker.domain.session.service.FrameProcessingService;
import com.incoresoft.presenceTracker.web.dto.DetectImageRequest;
import com.incoresoft.presenceTracker.web.dto.FrameRequest;
import com.incoresoft.presenceTracker.web.dto.FrameResponse;
import com.incoresoft.presenceTracker.web.dto.RegisterIdentityRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PresenceController {
    private final IdentityService identityService;
    private final FrameProcessingService frameService;

    /**
     * POST /api/identities {"name": "alice", "image": "<base64>"}
     * The image must contain exactly one face.
     */
    @PostMapping("/identities")
    public ResponseEntity<IdentitySummary> register(@Valid @RequestBody RegisterIdentityRequest req) {
        IdentitySummary summary = identityService.register(req.getName(), req.getImage());
        return ResponseEntity.status(HttpStatus.CREATED).body(summary);
    }

    @GetMapping("/identities")
    public IdentityListResponse list() {
        return identityService.list();
    }

    @DeleteMapping("/identities/{name}")
    public Map<String, String> delete(@PathVariable("name") String name) {
        identityService.delete(name);
        return Map.of("message", "User " + name.trim() + " deleted successfully");
    }

    @GetMapping("/identities/{name}/session")
    public PresenceSnapshot session(@PathVariable("name") String name) {
        return frameService.sessionSnapshot(name);
    }

    /** Pre-extracted faces of one frame. */
    @PostMapping("/frames")
    public FrameResponse frame(@Valid @RequestBody FrameRequest req) {
        return FrameResponse.of(frameService.processDetections(req.getFaces()));
    }

    /** Whole frame as an image, faces are extracted by the face API. */
    @PostMapping("/frames/image")
    public FrameResponse frameImage(@Valid @RequestBody DetectImageRequest req) {
        return FrameResponse.of(frameService.processImage(req.getImage()));
    }
}
