package com.questrail.speech.protocol.sauc.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recognition options declared in the {@code request} section of the initial
 * request.
 *
 * @param enableItn        inverse text normalization (numbers as digits)
 * @param enablePunc       punctuation
 * @param enableDdc        disfluency removal
 * @param showUtterances   return utterance spans with each result
 * @param modelName        service model name
 * @param resultType       {@code "full"} (cumulative text) or {@code "single"}
 * @param endWindowSizeMs  silence window closing an utterance; {@code null} for service default
 * @param extraParams      additional request parameters passed through verbatim
 */
public record RecognitionFeatures(
        boolean enableItn,
        boolean enablePunc,
        boolean enableDdc,
        boolean showUtterances,
        String modelName,
        String resultType,
        Integer endWindowSizeMs,
        Map<String, Object> extraParams
) {
    public RecognitionFeatures {
        Objects.requireNonNull(modelName, "modelName");
        Objects.requireNonNull(resultType, "resultType");
        if (endWindowSizeMs != null && endWindowSizeMs <= 0) {
            throw new IllegalArgumentException("endWindowSizeMs must be positive");
        }
        extraParams = (extraParams == null)
                ? Map.of()
                : Map.copyOf(extraParams);
    }

    public static RecognitionFeatures defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean enableItn = true;
        private boolean enablePunc = true;
        private boolean enableDdc = true;
        private boolean showUtterances = true;
        private String modelName = "bigmodel";
        private String resultType = "full";
        private Integer endWindowSizeMs;
        private final Map<String, Object> extraParams = new LinkedHashMap<>();

        public Builder withItn(boolean enabled) {
            this.enableItn = enabled;
            return this;
        }

        public Builder withPunctuation(boolean enabled) {
            this.enablePunc = enabled;
            return this;
        }

        public Builder withDisfluencyRemoval(boolean enabled) {
            this.enableDdc = enabled;
            return this;
        }

        public Builder withUtterances(boolean enabled) {
            this.showUtterances = enabled;
            return this;
        }

        public Builder withModelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder withResultType(String resultType) {
            this.resultType = resultType;
            return this;
        }

        public Builder withEndWindowSizeMs(Integer endWindowSizeMs) {
            this.endWindowSizeMs = endWindowSizeMs;
            return this;
        }

        public Builder withExtraParam(String name, Object value) {
            extraParams.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public RecognitionFeatures build() {
            return new RecognitionFeatures(enableItn, enablePunc, enableDdc, showUtterances,
                    modelName, resultType, endWindowSizeMs, extraParams);
        }
    }
}
