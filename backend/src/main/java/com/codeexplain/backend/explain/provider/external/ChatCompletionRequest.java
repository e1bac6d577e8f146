package com.codeexplain.backend.explain.provider.external;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
record ChatCompletionRequest(
    String model,
    List<Message> messages,
    @JsonProperty("max_tokens") Integer maxTokens,
    Double temperature,
    @JsonProperty("top_p") Double topP,
    @JsonProperty("frequency_penalty") Double frequencyPenalty,
    @JsonProperty("presence_penalty") Double presencePenalty) {

  record Message(String role, String content) {}

  static ChatCompletionRequest connectivityProbe(String model) {
    return new ChatCompletionRequest(
        model, List.of(new Message("user", "Test connectivity")), 1, null, null, null, null);
  }
}
