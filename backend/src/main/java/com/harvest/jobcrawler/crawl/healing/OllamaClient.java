package com.harvest.jobcrawler.crawl.healing;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.PoliteHttpClient;
import com.harvest.jobcrawler.crawl.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Client for a local Ollama {@code /api/generate} endpoint returning JSON-formatted completions.
 */
@Component
public class OllamaClient {
    private static final String JOB_PROMPT = """
        Role: Expert Technical Job Classifier.
        Task: Extract job details from the provided text snippet.

        Constraints:
        1. Return ONLY a valid JSON object.
        2. Required fields: "title", "company_name", "salary_text", "salary_type".
        3. Optional fields: "description", "address", "salary_min", "salary_max".
        4. Allowed salary_type: "月薪", "時薪", "年薪", "日薪", "面議".

        Data to analyze:
        %s

        JSON Result:
        """;

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CrawlerProperties.Healing config;

    public OllamaClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, CrawlerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getHealing();
    }

    /**
     * Asks the model for a job record derived from the page text.
     *
     * @throws AiHealingException when the service is unreachable or answers with something other than JSON
     */
    public JsonNode extractJob(String html) {
        String snippet = visibleText(html);
        if (snippet.length() > config.getMaxDocumentChars()) {
            snippet = snippet.substring(0, config.getMaxDocumentChars());
        }
        return generate(String.format(JOB_PROMPT, snippet), 0.1);
    }

    JsonNode generate(String prompt, double temperature) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", config.getModel());
        request.put("prompt", prompt);
        request.put("stream", false);
        request.put("format", "json");
        request.putObject("options").put("temperature", temperature);

        HttpFetchResult result;
        try {
            result = httpClient.postJson(
                config.getOllamaUrl() + "/api/generate",
                objectMapper.writeValueAsString(request),
                Duration.ofSeconds(config.getTimeoutSeconds())
            );
        } catch (JsonProcessingException e) {
            throw new AiHealingException("Could not encode generate request", e);
        }
        if (!result.isSuccessful() || !result.hasBody()) {
            throw new AiHealingException("Ollama call failed: " + result.describeFailure());
        }
        try {
            JsonNode envelope = objectMapper.readTree(result.body());
            String content = envelope.path("response").asText("")
                .replace("```json", "")
                .replace("```", "")
                .trim();
            if (content.isEmpty()) {
                throw new AiHealingException("Ollama returned an empty response");
            }
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new AiHealingException("Ollama returned malformed JSON", e);
        }
    }

    private static String visibleText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }
}
