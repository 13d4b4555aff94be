package enricher.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import enricher.config.EnrichConfig;
import enricher.core.ShutdownSignal;
import enricher.model.ColumnSpec;
import enricher.model.Row;
import enricher.transform.dto.ChatCompletionRequest;
import enricher.transform.dto.ChatCompletionResponse;
import enricher.transform.dto.ChatMessage;
import enricher.transform.dto.ErrorResponse;
import enricher.transform.dto.FunctionCall;
import enricher.transform.dto.Tool;
import enricher.transform.dto.ToolCall;
import enricher.transform.dto.ToolChoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Row transform backed by the OpenAI Chat Completions API.
 *
 * <p>Each row is one request with a forced call to the {@code extract_data}
 * function whose schema lists the target columns. The reply's function
 * arguments become the row's values. Cost units are the reply's
 * {@code usage.total_tokens}, reported on failures too once a reply was
 * received.</p>
 *
 * <p>The HTTP exchange runs asynchronously; the shutdown signal cancels it.</p>
 */
public final class OpenAiRowTransform implements RowTransform {

    private static final Logger log = LoggerFactory.getLogger(OpenAiRowTransform.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final EnrichConfig config;
    private final URI endpoint;

    public OpenAiRowTransform(HttpClient httpClient, ObjectMapper mapper, EnrichConfig config) {
        if (!config.hasApiKey()) {
            throw new IllegalStateException(EnrichConfig.ENV_API_KEY + " is not set");
        }
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.config = config;
        String base = config.baseUrl().endsWith("/")
                ? config.baseUrl().substring(0, config.baseUrl().length() - 1)
                : config.baseUrl();
        this.endpoint = URI.create(base + "/chat/completions");
        log.info("OpenAI transform: {} (model {})", endpoint, config.model());
    }

    @Override
    public TransformOutcome transform(Row row, List<ColumnSpec> targets, String instruction, ShutdownSignal signal)
            throws TransformException {
        if (signal.isCancelled()) {
            throw new TransformException("cancelled");
        }

        HttpRequest request = buildRequest(row, targets, instruction);
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());

        HttpResponse<String> response;
        try (ShutdownSignal.Registration cancel = signal.onCancel(() -> future.cancel(true))) {
            response = future.get();
        } catch (CancellationException e) {
            throw new TransformException("cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransformException("interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new TransformException("request timed out after " + config.requestTimeout().toSeconds() + "s", cause);
            }
            throw new TransformException("request failed: " + describe(cause), cause);
        }

        return parseResponse(response, targets);
    }

    HttpRequest buildRequest(Row row, List<ColumnSpec> targets, String instruction) throws TransformException {
        ChatCompletionRequest body = new ChatCompletionRequest(
                config.model(),
                List.of(ChatMessage.system(PromptBuilder.SYSTEM_PROMPT),
                        ChatMessage.user(PromptBuilder.userMessage(row, instruction))),
                List.of(Tool.function(PromptBuilder.FUNCTION_NAME, PromptBuilder.FUNCTION_DESCRIPTION,
                        PromptBuilder.argumentsSchema(targets))),
                ToolChoice.function(PromptBuilder.FUNCTION_NAME),
                config.temperature(),
                config.maxTokens());

        byte[] json;
        try {
            json = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new TransformException("could not encode request: " + e.getOriginalMessage(), e);
        }

        return HttpRequest.newBuilder()
                .uri(endpoint)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(config.requestTimeout())
                .POST(HttpRequest.BodyPublishers.ofByteArray(json))
                .build();
    }

    TransformOutcome parseResponse(HttpResponse<String> response, List<ColumnSpec> targets) throws TransformException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new TransformException("API error (status " + status + "): " + errorMessage(response.body()));
        }

        ChatCompletionResponse completion;
        try {
            completion = mapper.readValue(response.body(), ChatCompletionResponse.class);
        } catch (JsonProcessingException e) {
            throw new TransformException("invalid response body: " + e.getOriginalMessage(), e);
        }
        long tokens = completion.totalTokens();

        if (completion.choices() == null || completion.choices().isEmpty()) {
            throw new TransformException("no response from AI", tokens, null);
        }

        FunctionCall call = functionCall(completion.choices().get(0).message());
        if (call == null || call.arguments() == null) {
            throw new TransformException("no function call in response", tokens, null);
        }

        Map<String, String> values = parseArguments(call.arguments(), tokens);
        List<String> missing = new ArrayList<>();
        Map<String, String> produced = new LinkedHashMap<>();
        for (ColumnSpec spec : targets) {
            String value = values.get(spec.name());
            if (value == null) {
                missing.add(spec.name());
            } else {
                produced.put(spec.name(), value);
            }
        }
        if (!missing.isEmpty()) {
            throw new TransformException(TransformOutcome.missingMessage(missing), tokens, null);
        }
        return new TransformOutcome(produced, tokens);
    }

    /** Prefer the tool call; fall back to the legacy {@code function_call} field. */
    private static FunctionCall functionCall(ChatMessage message) {
        if (message == null)
            return null;
        if (message.toolCalls() != null) {
            for (ToolCall tc : message.toolCalls()) {
                if (tc.function() != null && PromptBuilder.FUNCTION_NAME.equals(tc.function().name())) {
                    return tc.function();
                }
            }
            if (!message.toolCalls().isEmpty() && message.toolCalls().get(0).function() != null) {
                return message.toolCalls().get(0).function();
            }
        }
        return message.functionCall();
    }

    /** Arguments object -> text values; JSON null becomes "", other scalars their text form. */
    private Map<String, String> parseArguments(String arguments, long tokens) throws TransformException {
        JsonNode node;
        try {
            node = mapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            throw new TransformException("failed to parse AI response: " + e.getOriginalMessage(), tokens, e);
        }
        if (node == null || !node.isObject()) {
            throw new TransformException("failed to parse AI response: arguments are not an object", tokens, null);
        }

        Map<String, String> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> {
            JsonNode v = e.getValue();
            String text = v.isNull() ? "" : v.isValueNode() ? v.asText() : v.toString();
            values.put(e.getKey(), text);
        });
        return values;
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank())
            return "empty body";
        try {
            ErrorResponse error = mapper.readValue(body, ErrorResponse.class);
            if (error.error() != null && error.error().message() != null) {
                return error.error().message();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    private static String describe(Throwable t) {
        if (t == null)
            return "unknown error";
        if (t instanceof IOException && t.getMessage() == null)
            return t.getClass().getSimpleName();
        return t.getMessage() != null ? t.getMessage() : t.toString();
    }
}
