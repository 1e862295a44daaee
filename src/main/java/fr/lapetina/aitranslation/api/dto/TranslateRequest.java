package fr.lapetina.aitranslation.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /v1/translate}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranslateRequest {

    private String text;
    private String context;

    @JsonProperty("maxProviders")
    private Integer maxProviders;

    @JsonProperty("request_id")
    private String requestId;

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }

    public Integer getMaxProviders() { return maxProviders; }
    public void setMaxProviders(Integer maxProviders) { this.maxProviders = maxProviders; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    /**
     * Requested provider count, or {@code defaultValue} when absent.
     */
    public int maxProvidersOr(int defaultValue) {
        return maxProviders != null ? maxProviders : defaultValue;
    }
}
