package io.newsharvest.ingestion.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.newsharvest.ingestion.api.dto.RewriteRequest;
import io.newsharvest.ingestion.api.dto.RewriteResult;
import io.newsharvest.ingestion.api.dto.StructuredArticle;
import io.newsharvest.ingestion.api.exception.ErrorCategory;
import io.newsharvest.ingestion.api.exception.RewriteCallException;
import io.newsharvest.ingestion.api.util.HtmlText;
import io.newsharvest.ingestion.api.util.RetryPolicies;
import io.newsharvest.ingestion.api.util.SlugGenerator;
import io.newsharvest.ingestion.config.NewsConfig;
import io.newsharvest.ingestion.config.RewriteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for an OpenAI-compatible chat-completions endpoint that turns extracted source text
 * into a structured article. Every failure, transport or shape, is returned as
 * {@link RewriteResult.Failure} so the caller can fall back to the raw content.
 */
@Service
public class ArticleRewriteService {

    private static final Logger logger = LoggerFactory.getLogger(ArticleRewriteService.class);

    static final int MAX_SEO_TITLE = 60;
    static final int MAX_SEO_DESCRIPTION = 160;
    static final int MAX_TAGS = 10;
    static final int MAX_LOCATION = 100;
    static final int MAX_EXCERPT = 300;

    private static final String DEFAULT_MODEL = "gpt-4o-mini";

    private static final String SYSTEM_PROMPT =
            "You are a news editor. You rewrite source articles into original, factual news copy "
                    + "and always answer with a single valid JSON object and nothing else.";

    private static final String USER_PROMPT = """
            Rewrite the following news article for the "%s" section.

            Rules:
            1. Keep every fact, name, number and date from the source. Do not invent anything.
            2. Write a new headline and body in neutral news style.
            3. The body must be HTML using only <p>, <h2>, <ul>, <li>, <strong> and <em>.
            4. The excerpt is one or two plain-text sentences, at most 300 characters.
            5. seoTitle at most 60 characters, seoDescription at most 160 characters.
            6. tags is an array of at most 10 short lowercase keywords.
            7. location is the main place the story is about, or an empty string.

            Source URL: %s
            Original title: %s

            Source text:
            %s

            Respond with exactly this JSON shape:
            {
              "title": "...",
              "excerpt": "...",
              "content": "<p>...</p>",
              "slug": "...",
              "seoTitle": "...",
              "seoDescription": "...",
              "tags": ["..."],
              "location": "..."
            }
            """;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RetryPolicies retryPolicies;
    private final RewriteConfig config;
    private final Clock clock;

    @Autowired
    public ArticleRewriteService(RestTemplate rewriteRestTemplate, ObjectMapper objectMapper,
                                 RetryPolicies retryPolicies, NewsConfig newsConfig) {
        this(rewriteRestTemplate, objectMapper, retryPolicies, newsConfig.rewrite(), Clock.systemDefaultZone());
    }

    ArticleRewriteService(RestTemplate restTemplate, ObjectMapper objectMapper, RetryPolicies retryPolicies,
                          RewriteConfig config, Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.retryPolicies = retryPolicies;
        this.config = config;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return config != null && config.enabled() && config.baseUrl() != null && !config.baseUrl().isBlank();
    }

    public RewriteResult rewrite(RewriteRequest request) {
        if (!isEnabled()) {
            return RewriteResult.failure("rewrite service disabled");
        }
        if (request.sourceText() == null || request.sourceText().isBlank()) {
            return RewriteResult.failure("no source text");
        }

        String answer;
        try {
            answer = retryPolicies.rewrite().<String, RewriteCallException>execute(context -> call(request));
        } catch (RewriteCallException e) {
            logger.warn("Rewrite call failed for {}: {} (category: {})", request.sourceUrl(), e.getMessage(), e.getCategory());
            return RewriteResult.failure(e.getMessage());
        }

        RewriteResult result = parseArticle(answer);
        if (result instanceof RewriteResult.Failure failure) {
            logger.warn("Rewrite response rejected for {}: {}", request.sourceUrl(), failure.reason());
        }
        return result;
    }

    private String call(RewriteRequest request) throws RewriteCallException {
        String prompt = USER_PROMPT.formatted(
                request.category(),
                request.sourceUrl(),
                request.originalTitle(),
                HtmlText.truncate(request.sourceText(), config.maxSourceChars())
        );

        Map<String, Object> body = Map.of(
                "model", config.model() != null ? config.model() : DEFAULT_MODEL,
                "temperature", 0.3,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)
                )
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            headers.setBearerAuth(config.apiKey());
        }

        String url = config.baseUrl().replaceAll("/+$", "") + "/chat/completions";

        String response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException e) {
            throw new RewriteCallException("Rewrite service returned " + e.getStatusCode().value(), e,
                    categorize(e.getStatusCode()));
        } catch (ResourceAccessException e) {
            ErrorCategory category = e.getCause() instanceof SocketTimeoutException
                    ? ErrorCategory.TIMEOUT
                    : ErrorCategory.NETWORK_ERROR;
            throw new RewriteCallException("Rewrite service unreachable: " + e.getMessage(), e, category);
        } catch (RestClientException e) {
            throw new RewriteCallException("Rewrite call failed: " + e.getMessage(), e, ErrorCategory.UNKNOWN);
        }

        return extractMessageContent(response);
    }

    private String extractMessageContent(String response) throws RewriteCallException {
        if (response == null || response.isBlank()) {
            throw new RewriteCallException("Empty response from rewrite service", ErrorCategory.PARSE_ERROR);
        }
        try {
            JsonNode content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new RewriteCallException("Response has no message content", ErrorCategory.PARSE_ERROR);
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new RewriteCallException("Response is not JSON: " + e.getOriginalMessage(), e, ErrorCategory.PARSE_ERROR);
        }
    }

    /**
     * Validates the model's answer field by field. Code fences around the JSON are tolerated.
     */
    RewriteResult parseArticle(String answer) {
        JsonNode json;
        try {
            json = objectMapper.readTree(stripCodeFence(answer));
        } catch (JsonProcessingException e) {
            return RewriteResult.failure("answer is not valid JSON: " + e.getOriginalMessage());
        }

        if (json == null || !json.isObject()) {
            return RewriteResult.failure("answer is not a JSON object");
        }

        String title = text(json, "title");
        String excerpt = text(json, "excerpt");
        String content = text(json, "content");

        if (title.isBlank()) return RewriteResult.failure("missing title");
        if (excerpt.isBlank()) return RewriteResult.failure("missing excerpt");
        if (content.isBlank()) return RewriteResult.failure("missing content");

        JsonNode tagsNode = json.get("tags");
        if (tagsNode != null && !tagsNode.isNull() && !tagsNode.isArray()) {
            return RewriteResult.failure("tags is not an array");
        }

        List<String> tags = new ArrayList<>();
        if (tagsNode != null && tagsNode.isArray()) {
            for (JsonNode tag : tagsNode) {
                if (tags.size() >= MAX_TAGS) break;
                if (tag.isTextual() && !tag.asText().isBlank()) {
                    tags.add(tag.asText().trim());
                }
            }
        }

        String slugSource = text(json, "slug").isBlank() ? title : text(json, "slug");
        String seoTitle = text(json, "seoTitle").isBlank() ? title : text(json, "seoTitle");
        String seoDescription = text(json, "seoDescription").isBlank() ? excerpt : text(json, "seoDescription");

        return RewriteResult.success(new StructuredArticle(
                title,
                HtmlText.excerpt(excerpt, MAX_EXCERPT),
                content,
                SlugGenerator.generate(slugSource, clock),
                HtmlText.truncate(seoTitle, MAX_SEO_TITLE),
                HtmlText.truncate(seoDescription, MAX_SEO_DESCRIPTION),
                tags,
                HtmlText.truncate(text(json, "location"), MAX_LOCATION)
        ));
    }

    static String stripCodeFence(String answer) {
        if (answer == null) return "";

        String trimmed = answer.trim();
        if (trimmed.startsWith("```")) {
            trimmed = trimmed.replaceFirst("^```[a-zA-Z]*\\s*", "");
            trimmed = trimmed.replaceFirst("\\s*```\\s*$", "");
        }
        return trimmed.trim();
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node != null && node.isTextual() ? node.asText().trim() : "";
    }

    private static ErrorCategory categorize(HttpStatusCode status) {
        if (status.value() == 429) return ErrorCategory.RATE_LIMITED;
        if (status.value() == 401) return ErrorCategory.AUTH_REQUIRED;
        if (status.value() == 403) return ErrorCategory.ACCESS_FORBIDDEN;
        if (status.value() == 404) return ErrorCategory.NOT_FOUND;
        if (status.is5xxServerError()) return ErrorCategory.SERVER_ERROR;
        return ErrorCategory.HTTP_ERROR;
    }
}
