package io.github.riemr.mobilepost.infrastructure.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.riemr.mobilepost.application.exception.BatchSourceException;
import io.github.riemr.mobilepost.application.importing.BatchSource;
import io.github.riemr.mobilepost.application.importing.ImportRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads rows from the configured remote JSON feed. The payload is either an array of objects or an
 * object whose first array-valued property holds them.
 */
@Component
@Slf4j
public class JsonFeedBatchSource implements BatchSource {
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String feedUrl;

    public JsonFeedBatchSource(RestTemplate importFeedRestTemplate,
                               ObjectMapper objectMapper,
                               @Value("${mobilepost.import.feed-url:}") String feedUrl) {
        this.restTemplate = importFeedRestTemplate;
        this.objectMapper = objectMapper;
        this.feedUrl = feedUrl;
    }

    @Override
    public String describe() {
        return feedUrl;
    }

    @Override
    public List<ImportRow> read() {
        if (!StringUtils.hasText(feedUrl)) {
            throw new BatchSourceException("Import feed URL is not configured (mobilepost.import.feed-url)");
        }
        log.info("Fetching mobile post feed from {}", feedUrl);
        String body;
        try {
            body = restTemplate.getForObject(feedUrl, String.class);
        } catch (RestClientException e) {
            log.error("Error fetching mobile post feed {}: {}", feedUrl, e.getMessage());
            throw new BatchSourceException("Import feed is unavailable. Please try again later.", e);
        }
        if (body == null || body.isBlank()) {
            throw new BatchSourceException("Import feed returned an empty response");
        }
        return parse(body);
    }

    List<ImportRow> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("Mobile post feed {} is not valid JSON: {}", feedUrl, e.getOriginalMessage());
            throw new BatchSourceException("Import feed is not valid JSON", e);
        }
        JsonNode items = findItems(root);
        if (items == null) {
            throw new BatchSourceException("Import feed does not contain a list of records");
        }
        List<ImportRow> rows = new ArrayList<>(items.size());
        int index = 0;
        for (JsonNode item : items) {
            index++;
            Map<String, Object> fields = item.isObject() ? objectMapper.convertValue(item, ROW_TYPE) : Map.of();
            rows.add(new ImportRow(index, fields));
        }
        log.info("Read {} rows from {}", rows.size(), feedUrl);
        return rows;
    }

    private static JsonNode findItems(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            Iterator<JsonNode> values = root.elements();
            while (values.hasNext()) {
                JsonNode value = values.next();
                if (value.isArray()) {
                    return value;
                }
            }
        }
        return null;
    }
}
