package io.github.drompincen.mockjira.runtime.model;

import java.time.Instant;

public record Approval(String id, String decision, String deciderId, Instant created) {

    public static final String APPROVED = "approved";
    public static final String DECLINED = "declined";
}
