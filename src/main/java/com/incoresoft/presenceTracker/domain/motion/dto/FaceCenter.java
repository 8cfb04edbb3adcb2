package com.incoresoft.presenceTracker.domain.motion.dto;

public record FaceCenter(int x, int y) {

    public double distanceTo(FaceCenter other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
