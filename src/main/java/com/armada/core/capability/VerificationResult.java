package com.armada.core.capability;

import java.util.List;

public record VerificationResult(boolean valid, String summary, List<String> details) {

    public static VerificationResult passed(String summary) {
        return new VerificationResult(true, summary, List.of());
    }

    public static VerificationResult failed(String summary, List<String> details) {
        return new VerificationResult(false, summary, details);
    }
}
