package com.codeexplain.backend.explain.provider.external;

import com.codeexplain.backend.explain.config.ExplainBackendsProperties;
import com.codeexplain.backend.explain.provider.AbstractExplanationBackend;
import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.ExplanationBackendException;
import com.codeexplain.backend.explain.provider.ExplanationCancelledException;
import com.codeexplain.backend.explain.provider.model.ExplainOptions;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import com.codeexplain.backend.explain.provider.model.TokenUsage;
import com.codeexplain.backend.explain.retry.CallContext;
import com.codeexplain.backend.explain.retry.RetryEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

/** Backend calling an OpenAI compatible chat completions endpoint. */
public class ExternalApiExplanationBackend extends AbstractExplanationBackend {

  public static final String TYPE = "external";

  static final String CHAT_COMPLETIONS_PATH = "/v1/chat/completions";
  static final String REQUEST_ID_HEADER = "X-Request-ID";
  static final String USER_AGENT = "code-explain/0.1";
  static final String CONNECTIVITY_REQUEST_ID = "connectivity-test";
  static final int DEFAULT_MAX_TOKENS = 2000;
  static final double DEFAULT_TEMPERATURE = 0.6;
  static final double TOP_P = 0.9;
  static final double FREQUENCY_PENALTY = 0.1;
  static final double PRESENCE_PENALTY = 0.1;

  private final ExplainBackendsProperties.External external;
  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final ApiErrorMapper errorMapper;
  private final ExplanationPromptBuilder promptBuilder = new ExplanationPromptBuilder();

  public ExternalApiExplanationBackend(
      String name,
      ExplainBackendsProperties.Backend settings,
      RetryEngine retryEngine,
      WebClient.Builder webClientBuilder,
      ObjectMapper objectMapper) {
    super(name, settings, retryEngine);
    this.external = Objects.requireNonNull(settings.getExternal(), "external settings");
    this.webClient = webClientBuilder.clone().build();
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.errorMapper = new ApiErrorMapper(name, objectMapper, retryEngine.clock());
  }

  /** Appends {@code /v1/chat/completions} unless the URL already points at it. */
  static String chatCompletionsUrl(String apiUrl) {
    String base = apiUrl.trim();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    if (base.endsWith(CHAT_COMPLETIONS_PATH)) {
      return base;
    }
    if (base.endsWith("/v1")) {
      return base + "/chat/completions";
    }
    return base + CHAT_COMPLETIONS_PATH;
  }

  static boolean isLocalUrl(String apiUrl) {
    return apiUrl != null
        && (apiUrl.contains("localhost")
            || apiUrl.contains("127.0.0.1")
            || apiUrl.contains("0.0.0.0"));
  }

  static boolean hasRecognisedKeyPrefix(String apiKey) {
    return apiKey != null && (apiKey.startsWith("sk-") || apiKey.startsWith("org-"));
  }

  @Override
  protected ExplanationResult doGenerate(
      String query, List<SearchResult> results, ExplainOptions options) {
    CallContext context = newCallContext(query, results.size());
    ChatCompletionRequest request = buildRequest(query, results, options);
    Duration timeout = effectiveTimeout(options);
    log.debug(
        "Request {} to {} with model {} ({} results)",
        context.requestId(),
        name(),
        request.model(),
        results.size());

    ChatCompletionResponse response =
        retryEngine.execute(
            context, "chat completion", () -> send(request, context.requestId(), timeout));
    return toResult(response, request);
  }

  ChatCompletionRequest buildRequest(
      String query, List<SearchResult> results, ExplainOptions options) {
    String model = StringUtils.hasText(options.model()) ? options.model() : external.getModel();
    Integer maxTokens =
        options.maxTokens() != null
            ? options.maxTokens()
            : external.getMaxTokens() != null ? external.getMaxTokens() : DEFAULT_MAX_TOKENS;
    Double temperature =
        external.getTemperature() != null ? external.getTemperature() : DEFAULT_TEMPERATURE;
    List<ChatCompletionRequest.Message> messages =
        List.of(
            new ChatCompletionRequest.Message("system", promptBuilder.systemPrompt(query)),
            new ChatCompletionRequest.Message(
                "user", promptBuilder.userMessage(query, results)));
    return new ChatCompletionRequest(
        model, messages, maxTokens, temperature, TOP_P, FREQUENCY_PENALTY, PRESENCE_PENALTY);
  }

  private ChatCompletionResponse send(
      ChatCompletionRequest request, String requestId, Duration timeout) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException ex) {
      throw failure("Failed to serialize chat completion request", ErrorKind.CONFIGURATION_ERROR, ex);
    }
    try {
      return webClient
          .post()
          .uri(chatCompletionsUrl(external.getApiUrl()))
          .contentType(MediaType.APPLICATION_JSON)
          .accept(MediaType.APPLICATION_JSON)
          .headers(
              headers -> {
                headers.setBearerAuth(external.getApiKey());
                headers.set(REQUEST_ID_HEADER, requestId);
                headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
              })
          .bodyValue(payload)
          .exchangeToMono(
              response ->
                  response
                      .bodyToMono(String.class)
                      .defaultIfEmpty("")
                      .map(
                          body ->
                              readResponse(
                                  response.statusCode(),
                                  response.headers().asHttpHeaders(),
                                  body)))
          .timeout(timeout)
          .block();
    } catch (ExplanationBackendException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw translateTransportFailure(ex, timeout);
    }
  }

  private ChatCompletionResponse readResponse(
      HttpStatusCode status, HttpHeaders headers, String body) {
    if (!status.is2xxSuccessful()) {
      throw errorMapper.toException(status.value(), body, headers);
    }
    try {
      return objectMapper.readValue(body, ChatCompletionResponse.class);
    } catch (JsonProcessingException ex) {
      throw failure(
          "Failed to parse external API response: " + ex.getOriginalMessage(),
          ErrorKind.RESPONSE_FORMAT_ERROR,
          ex);
    }
  }

  private RuntimeException translateTransportFailure(RuntimeException ex, Duration timeout) {
    Throwable cause = Exceptions.unwrap(ex);
    if (cause instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
      Thread.currentThread().interrupt();
      return new ExplanationCancelledException("External API request cancelled", cause);
    }
    if (cause instanceof TimeoutException) {
      return failure(
          "External API request timed out after " + timeout.toMillis() + "ms",
          ErrorKind.NETWORK_ERROR,
          cause);
    }
    if (cause instanceof WebClientRequestException requestException) {
      return failure(
          "Network error contacting external API: " + requestException.getMessage(),
          ErrorKind.NETWORK_ERROR,
          requestException);
    }
    return failure(
        "External API request failed: " + cause.getMessage(), ErrorKind.NETWORK_ERROR, cause);
  }

  private ExplanationResult toResult(
      ChatCompletionResponse response, ChatCompletionRequest request) {
    if (response == null || response.choices() == null || response.choices().isEmpty()) {
      throw failure(
          "External API returned no choices in response", ErrorKind.RESPONSE_FORMAT_ERROR);
    }
    ChatCompletionResponse.Choice choice = response.choices().get(0);
    String content = choice.message() != null ? choice.message().content() : null;
    if (!StringUtils.hasText(content)) {
      throw failure("External API returned empty response content", ErrorKind.RESPONSE_FORMAT_ERROR);
    }
    TokenUsage usage = toUsage(response.usage());
    String model = StringUtils.hasText(response.model()) ? response.model() : request.model();
    return ExplanationResult.success(
        content.trim(), model, usage, response.id(), choice.finishReason());
  }

  private TokenUsage toUsage(ChatCompletionResponse.Usage usage) {
    if (usage == null) {
      return null;
    }
    if (isNegative(usage.promptTokens())
        || isNegative(usage.completionTokens())
        || isNegative(usage.totalTokens())) {
      throw failure(
          "External API returned invalid token usage", ErrorKind.RESPONSE_FORMAT_ERROR);
    }
    return new TokenUsage(usage.promptTokens(), usage.completionTokens(), usage.totalTokens());
  }

  private static boolean isNegative(Integer value) {
    return value != null && value < 0;
  }

  @Override
  protected void validateBackendSettings() {
    String apiUrl = external.getApiUrl();
    if (!StringUtils.hasText(apiUrl)) {
      throw failure("External API URL is required", ErrorKind.CONFIGURATION_ERROR);
    }
    try {
      URI uri = new URI(apiUrl.trim());
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
        throw failure("Invalid external API URL: " + apiUrl, ErrorKind.CONFIGURATION_ERROR);
      }
    } catch (URISyntaxException ex) {
      throw failure("Invalid external API URL: " + apiUrl, ErrorKind.CONFIGURATION_ERROR, ex);
    }
    if (!StringUtils.hasText(external.getApiKey())) {
      throw failure("External API key is required", ErrorKind.CONFIGURATION_ERROR);
    }
    if (!StringUtils.hasText(external.getModel())) {
      throw failure("External API model is required", ErrorKind.CONFIGURATION_ERROR);
    }
    if (external.getMaxTokens() != null && external.getMaxTokens() <= 0) {
      throw failure("Max tokens must be a positive number", ErrorKind.CONFIGURATION_ERROR);
    }
    Double temperature = external.getTemperature();
    if (temperature != null && (temperature < 0 || temperature > 2)) {
      throw failure("Temperature must be between 0 and 2", ErrorKind.CONFIGURATION_ERROR);
    }
    if (!isLocalUrl(apiUrl) && !hasRecognisedKeyPrefix(external.getApiKey())) {
      log.warn("API key for backend '{}' does not look like an OpenAI key", name());
    }
  }

  @Override
  protected void probeAvailability() {
    send(
        ChatCompletionRequest.connectivityProbe(external.getModel()),
        CONNECTIVITY_REQUEST_ID,
        settings.getTimeout());
  }

  @Override
  protected String type() {
    return TYPE;
  }

  @Override
  protected String description() {
    return "OpenAI compatible chat completions API";
  }

  @Override
  protected Map<String, Object> describeConfiguration() {
    Map<String, Object> configuration = new LinkedHashMap<>();
    configuration.put(
        "apiUrl",
        StringUtils.hasText(external.getApiUrl())
            ? chatCompletionsUrl(external.getApiUrl())
            : null);
    configuration.put("model", external.getModel());
    configuration.put(
        "maxTokens", external.getMaxTokens() != null ? external.getMaxTokens() : DEFAULT_MAX_TOKENS);
    configuration.put(
        "temperature",
        external.getTemperature() != null ? external.getTemperature() : DEFAULT_TEMPERATURE);
    configuration.put(
        "timeoutMs", settings.getTimeout() != null ? settings.getTimeout().toMillis() : null);
    configuration.put("maxRetries", settings.getMaxRetries());
    return configuration;
  }

  @Override
  protected List<String> capabilities() {
    return List.of("code-explanation", "token-usage", "rate-limit-handling");
  }
}
