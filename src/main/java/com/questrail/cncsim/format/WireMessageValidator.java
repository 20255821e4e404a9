package com.questrail.cncsim.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects messages that must not reach the wire.
 *
 * <p>Common rules: a value is present, the timestamp is present and not
 * negative, the destination is not blank. Compact messages additionally need
 * a location path, a data contract and a tag name, and a destination under
 * {@code umh.v1.}.</p>
 */
public final class WireMessageValidator
{
    /**
     * @throws ValidationException listing every problem found
     */
    public void validate(WireMessage message) {
        List<String> problems = problems(message);
        if (!problems.isEmpty()) {
            throw new ValidationException(message.destination(), problems);
        }
    }

    public boolean isValid(WireMessage message) {
        return problems(message).isEmpty();
    }

    public List<String> problems(WireMessage message) {
        List<String> problems = new ArrayList<>();

        if (message.value() == null) {
            problems.add("value missing");
        }
        if (message.timestampMs() == null) {
            problems.add("timestamp_ms missing");
        } else if (message.timestampMs() < 0) {
            problems.add("timestamp_ms negative");
        }
        if (isBlank(message.destination())) {
            problems.add("destination blank");
        }

        if (message.schema() == WireSchema.HIERARCHICAL
                && message.destination() != null
                && message.destination().endsWith(HierarchicalSchemaAdapter.SEPARATOR)) {
            problems.add("sensor key blank");
        }

        if (message.schema() == WireSchema.COMPACT) {
            if (isBlank(message.metadataString("location_path"))) {
                problems.add("location_path blank");
            }
            if (isBlank(message.metadataString("data_contract"))) {
                problems.add("data_contract blank");
            }
            if (isBlank(message.metadataString("tag_name"))) {
                problems.add("tag_name blank");
            }
            if (message.destination() != null && !message.destination().startsWith(CompactSchemaAdapter.PREFIX)) {
                problems.add("destination does not start with " + CompactSchemaAdapter.PREFIX);
            }
        }
        return problems;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
