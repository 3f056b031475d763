package com.phillippitts.voicegate.service.cache;

import com.phillippitts.voicegate.domain.OperationResult;
import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.SttResponse;
import com.phillippitts.voicegate.domain.TtsResponse;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * JSON serialization of successful results for the cache store (org.json).
 *
 * <p>Only the payload fields are stored; processing time and the cache-hit flag are set when the
 * entry is served.
 */
public class ResultCodec {

    static final int VERSION = 1;

    public byte[] encode(OperationResult result) {
        JSONObject json = new JSONObject();
        json.put("v", VERSION);
        json.put("provider", result.provider());
        if (result instanceof SttResponse stt) {
            json.put("kind", ProviderCategory.STT.label());
            json.put("text", stt.text());
            json.putOpt("confidence", stt.confidence());
            json.putOpt("language", stt.language());
        } else if (result instanceof TtsResponse tts) {
            json.put("kind", ProviderCategory.TTS.label());
            json.put("audioRef", tts.audioRef());
            json.putOpt("contentType", tts.contentType());
        } else {
            throw new IllegalArgumentException("Unsupported result type " + result.getClass().getName());
        }
        return json.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return the decoded result, or empty when the bytes are not a valid entry of the expected kind
     */
    public Optional<OperationResult> decode(byte[] bytes, ProviderCategory expected) {
        try {
            JSONObject json = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            if (json.optInt("v", -1) != VERSION || !expected.label().equals(json.optString("kind"))) {
                return Optional.empty();
            }
            String provider = json.getString("provider");
            if (expected == ProviderCategory.STT) {
                Double confidence = json.has("confidence") ? json.getDouble("confidence") : null;
                return Optional.of(SttResponse.success(json.getString("text"), confidence,
                        json.optString("language", null), provider, 0L));
            }
            return Optional.of(TtsResponse.success(json.getString("audioRef"),
                    json.optString("contentType", null), provider, 0L));
        } catch (JSONException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
