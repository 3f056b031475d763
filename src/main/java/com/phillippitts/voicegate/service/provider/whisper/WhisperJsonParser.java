package com.phillippitts.voicegate.service.provider.whisper;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Parses whisper.cpp JSON output ({@code -oj}).
 *
 * <p>Accepts either a top-level {@code text} field or the {@code transcription[]} / {@code segments[]}
 * arrays that whisper.cpp emits, concatenating segment texts with single spaces.
 */
final class WhisperJsonParser {

    private WhisperJsonParser() {}

    /**
     * @param json whisper stdout
     * @return trimmed text, or empty when the output is not JSON or has no text
     */
    static Optional<String> extractText(String json) {
        Optional<JSONObject> obj = parse(json);
        if (obj.isEmpty()) {
            return Optional.empty();
        }
        JSONObject root = obj.get();
        String top = root.optString("text", "").trim();
        if (!top.isEmpty()) {
            return Optional.of(top);
        }
        String joined = joinSegments(root.optJSONArray("transcription"));
        if (joined.isEmpty()) {
            joined = joinSegments(root.optJSONArray("segments"));
        }
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
    }

    /**
     * @return language reported under {@code result.language}, if any
     */
    static Optional<String> extractLanguage(String json) {
        return parse(json)
                .map(o -> o.optJSONObject("result"))
                .map(r -> r.optString("language", ""))
                .filter(s -> !s.isBlank());
    }

    static boolean looksLikeJson(String output) {
        return output != null && output.stripLeading().startsWith("{");
    }

    private static Optional<JSONObject> parse(String json) {
        if (!looksLikeJson(json)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new JSONObject(json));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }

    private static String joinSegments(JSONArray segs) {
        if (segs == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segs.length(); i++) {
            JSONObject seg = segs.optJSONObject(i);
            if (seg == null) {
                continue;
            }
            String t = seg.optString("text", "").trim();
            if (!t.isEmpty()) {
                if (!sb.isEmpty()) {
                    sb.append(' ');
                }
                sb.append(t);
            }
        }
        return sb.toString();
    }
}
