package io.swarmcron.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Label selector for object queries. An object matches when it carries every entry.
 *
 * <p>This is an API-layer object; each {@code ObjectClient} translates it into its own filter syntax.
 */
public record LabelFilter(Map<String, String> labels) {

    public LabelFilter {
        Objects.requireNonNull(labels, "labels must not be null");
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("LabelFilter must include at least one label");
        }
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * Every object owned by the scheduler.
     */
    public static LabelFilter marker() {
        return new LabelFilter(Map.of(LabelSchema.MARKER, LabelSchema.MARKER_VALUE));
    }

    /**
     * Every object created for {@code jobName}.
     */
    public static LabelFilter job(String jobName) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Map<String, String> m = new LinkedHashMap<>();
        m.put(LabelSchema.MARKER, LabelSchema.MARKER_VALUE);
        m.put(LabelSchema.NAME, jobName);
        return new LabelFilter(m);
    }

    public boolean matches(Map<String, String> objectLabels) {
        if (objectLabels == null) {
            return false;
        }
        for (var e : labels.entrySet()) {
            if (!e.getValue().equals(objectLabels.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
