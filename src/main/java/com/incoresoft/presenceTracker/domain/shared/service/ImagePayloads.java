package com.incoresoft.presenceTracker.domain.shared.service;

import org.springframework.util.StringUtils;

import java.util.Base64;
import java.util.List;

/**
 * Decoding of base64 image payloads as sent by browsers (optionally as a data URL).
 */
public final class ImagePayloads {

    private ImagePayloads() {
    }

    /**
     * @throws IllegalArgumentException when the payload is missing or not valid base64
     */
    public static byte[] decode(String payload) {
        if (!StringUtils.hasText(payload)) {
            throw new IllegalArgumentException("Image is required");
        }
        String data = payload.trim();
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(data);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Image is not valid base64", ex);
        }
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Image is empty");
        }
        return bytes;
    }

    /** Lenient variant for optional crops: missing or broken payloads give an empty array. */
    public static byte[] decodeOptional(String payload) {
        if (!StringUtils.hasText(payload)) return new byte[0];
        try {
            return decode(payload);
        } catch (IllegalArgumentException ex) {
            return new byte[0];
        }
    }

    public static double[] toVector(List<Double> encoding) {
        if (encoding == null) return new double[0];
        double[] v = new double[encoding.size()];
        for (int i = 0; i < v.length; i++) {
            Double d = encoding.get(i);
            if (d == null) throw new IllegalArgumentException("Face encoding contains null values");
            v[i] = d;
        }
        return v;
    }
}
