package com.ingestmanager.ingestmanager.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thin client pulling a JSON document over HTTP GET and extracting an array of records from it.
 *
 * <p>Arguments: {@code url} (required), {@code params} (query parameters, values are stringified)
 * and {@code records_path}, a JSON pointer such as {@code /response/result/items} locating the
 * record array. Without a pointer the document root must be the array.
 */
@Component
public class HttpJsonDataFetcher implements DataFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpJsonDataFetcher.class);
    static final String SOURCE_NAME = "http";
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public HttpJsonDataFetcher(RestTemplate ingestionRestTemplate, ObjectMapper objectMapper) {
        this.restTemplate = ingestionRestTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public List<Map<String, Object>> fetch(Map<String, Object> args) {
        URI uri = buildUri(args);
        String body;
        try {
            body = restTemplate.getForObject(uri, String.class);
        } catch (RestClientException ex) {
            throw new FetchException("HTTP request to " + uri.getHost() + " failed: " + ex.getMessage(), ex);
        }
        if (body == null || body.isBlank()) {
            throw new FetchException("Empty response body from " + uri.getHost());
        }

        JsonNode records = locateRecords(parse(body), SourceArgs.optionalString(args, "records_path", ""));
        List<Map<String, Object>> result = new ArrayList<>(records.size());
        for (JsonNode node : records) {
            if (!node.isObject()) {
                throw new FetchException("Record is not a JSON object: " + node.getNodeType());
            }
            result.add(objectMapper.convertValue(node, RECORD_TYPE));
        }
        log.debug("Fetched {} records from {}", result.size(), uri.getHost());
        return result;
    }

    private URI buildUri(Map<String, Object> args) {
        String url = SourceArgs.requiredString(args, "url");
        try {
            UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url);
            Object params = args.get("params");
            if (params instanceof Map<?, ?> query) {
                for (Map.Entry<?, ?> entry : query.entrySet()) {
                    if (entry.getValue() != null) {
                        builder.queryParam(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
                    }
                }
            } else if (params != null) {
                throw new FetchException("Argument 'params' must be an object");
            }
            return builder.encode().build().toUri();
        } catch (IllegalArgumentException ex) {
            throw new FetchException("Invalid url: " + url, ex);
        }
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new FetchException("Unable to decode JSON response: " + ex.getOriginalMessage(), ex);
        }
    }

    private JsonNode locateRecords(JsonNode document, String recordsPath) {
        JsonNode records;
        try {
            records = recordsPath.isBlank() ? document : document.at(JsonPointer.compile(recordsPath.trim()));
        } catch (IllegalArgumentException ex) {
            throw new FetchException("Invalid records_path: " + recordsPath, ex);
        }
        if (records == null || !records.isArray()) {
            throw new FetchException("No record array found at '" + recordsPath + "'");
        }
        return records;
    }
}
