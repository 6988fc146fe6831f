package io.swarmcron.core;

import java.time.Instant;

public record RunTask(
        String id,
        Instant createdAt,
        String status
) {
}
