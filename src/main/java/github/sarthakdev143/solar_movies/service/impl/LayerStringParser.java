package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.dto.LayerRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the compact layer form {@code [sourceId,visible,opacity],[sourceId,visible,opacity]}.
 */
@Component
public class LayerStringParser {

    private static final Pattern LAYER_PATTERN = Pattern.compile("\\[([^\\[\\]]*)]");

    public List<LayerRequest> parse(String layerString) {
        if (layerString == null || layerString.isBlank()) {
            throw new IllegalArgumentException("layers is required.");
        }

        String trimmed = layerString.trim();
        Matcher matcher = LAYER_PATTERN.matcher(trimmed);
        List<LayerRequest> layers = new ArrayList<>();
        int expectedStart = 0;

        while (matcher.find()) {
            String separator = trimmed.substring(expectedStart, matcher.start());
            if (!separator.isEmpty() && !separator.equals(",")) {
                throw new IllegalArgumentException("layers must look like [sourceId,visible,opacity],[...].");
            }
            layers.add(parseSingleLayer(layers.size(), matcher.group(1)));
            expectedStart = matcher.end();
        }

        if (layers.isEmpty() || expectedStart != trimmed.length()) {
            throw new IllegalArgumentException("layers must look like [sourceId,visible,opacity],[...].");
        }
        return layers;
    }

    private LayerRequest parseSingleLayer(int index, String body) {
        String[] parts = body.split(",", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException(
                    "layers[" + index + "] must have exactly three values: sourceId,visible,opacity.");
        }

        int sourceId = parseInt(parts[0], "layers[" + index + "].sourceId");
        boolean visible = parseVisible(parts[1], "layers[" + index + "].visible");
        int opacity = parseInt(parts[2], "layers[" + index + "].opacity");
        return new LayerRequest(sourceId, visible, opacity, null);
    }

    private boolean parseVisible(String value, String fieldName) {
        String normalized = value.trim();
        return switch (normalized) {
            case "1", "true" -> true;
            case "0", "false" -> false;
            default -> throw new IllegalArgumentException(fieldName + " must be 0, 1, true or false.");
        };
    }

    private int parseInt(String value, String fieldName) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(fieldName + " must be an integer.", e);
        }
    }
}
