package io.syncbeat.odoo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncbeat.mirror.PagedFetch;
import io.syncbeat.mirror.RemoteAuthException;
import io.syncbeat.mirror.RemoteQuery;
import io.syncbeat.mirror.RemoteSource;
import io.syncbeat.mirror.RemoteTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * JSON-RPC client for Odoo's external API.
 *
 * <p>The session is established lazily on the first read and reused until Odoo reports it expired.
 * Each {@link #fetchAll(RemoteQuery)} run may re-authenticate once.
 */
public class OdooClient implements RemoteSource {

    private static final Logger log = LoggerFactory.getLogger(OdooClient.class);

    static final String AUTHENTICATE_PATH = "/web/session/authenticate";
    static final String JSONRPC_PATH = "/jsonrpc";
    static final String SESSION_COOKIE = "session_id";
    static final int SESSION_EXPIRED_CODE = 100;

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {
    };

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final OdooProperties props;
    private final AtomicLong requestIds = new AtomicLong();

    private volatile OdooSession session;

    public OdooClient(RestClient restClient, ObjectMapper objectMapper, OdooProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        if (props.getPageSize() <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + props.getPageSize());
        }
    }

    /**
     * Opens a new session, replacing any current one.
     *
     * @throws RemoteAuthException      when Odoo returns no uid or no session cookie
     * @throws RemoteTransportException when the call itself fails
     */
    public synchronized OdooSession authenticate() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("db", props.getDatabase());
        params.put("login", props.getUsername());
        params.put("password", props.getPassword());

        ResponseEntity<String> response = post(AUTHENTICATE_PATH, envelope(params), null);
        JsonNode body = readBody(response.getBody());
        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            throw new RemoteAuthException("Odoo rejected login for user " + props.getUsername()
                    + ": " + errorMessage(error));
        }

        JsonNode uid = body.path("result").path("uid");
        if (!uid.isIntegralNumber() || uid.asLong() <= 0) {
            throw new RemoteAuthException("Odoo returned no uid for user " + props.getUsername());
        }
        String sessionId = sessionCookie(response.getHeaders());
        if (sessionId == null) {
            throw new RemoteAuthException("Odoo returned no session cookie for user " + props.getUsername());
        }

        OdooSession opened = new OdooSession(uid.asLong(), sessionId);
        this.session = opened;
        log.info("Authenticated with Odoo url={} db={} uid={}", props.getUrl(), props.getDatabase(), opened.uid());
        return opened;
    }

    @Override
    public List<Map<String, Object>> fetchPage(RemoteQuery query, int limit, int offset) {
        return fetchPage(query, limit, offset, new AtomicBoolean(false));
    }

    @Override
    public Stream<Map<String, Object>> fetchAll(RemoteQuery query) {
        AtomicBoolean reauthenticated = new AtomicBoolean(false);
        return PagedFetch.stream(pageSize(), (limit, offset) -> fetchPage(query, limit, offset, reauthenticated));
    }

    @Override
    public int pageSize() {
        return props.getPageSize();
    }

    /**
     * Drops the current session; the next read authenticates again.
     */
    public void invalidateSession() {
        this.session = null;
    }

    OdooSession currentSession() {
        return session;
    }

    private List<Map<String, Object>> fetchPage(RemoteQuery query, int limit, int offset,
                                                AtomicBoolean reauthenticated) {
        Objects.requireNonNull(query, "query must not be null");
        while (true) {
            OdooSession s = session;
            if (s == null) {
                s = authenticate();
            }
            try {
                return searchRead(s, query, limit, offset);
            } catch (SessionExpiredException e) {
                invalidateSession();
                if (!reauthenticated.compareAndSet(false, true)) {
                    throw new RemoteAuthException("Odoo session expired again after re-authentication", e);
                }
                log.warn("Odoo session expired, re-authenticating model={} offset={}", query.model(), offset);
            }
        }
    }

    private List<Map<String, Object>> searchRead(OdooSession s, RemoteQuery query, int limit, int offset) {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("fields", query.fields());
        kwargs.put("limit", limit);
        kwargs.put("offset", offset);
        if (query.order() != null) {
            kwargs.put("order", query.order());
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("service", "object");
        params.put("method", "execute_kw");
        params.put("args", List.of(
                props.getDatabase(),
                s.uid(),
                props.getPassword(),
                query.model(),
                "search_read",
                List.of(query.domain()),
                kwargs));

        ResponseEntity<String> response = post(JSONRPC_PATH, envelope(params), s.sessionId());
        JsonNode body = readBody(response.getBody());
        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            if (error.path("code").asInt() == SESSION_EXPIRED_CODE) {
                throw new SessionExpiredException(errorMessage(error));
            }
            throw new RemoteTransportException("Odoo search_read on " + query.model() + " failed: " + errorMessage(error));
        }

        JsonNode result = body.get("result");
        if (result == null || result.isNull()) {
            return List.of();
        }
        if (!result.isArray()) {
            throw new RemoteTransportException("Odoo search_read on " + query.model() + " returned no record list");
        }
        try {
            return objectMapper.convertValue(result, RECORDS);
        } catch (IllegalArgumentException e) {
            throw new RemoteTransportException("Malformed records from Odoo model " + query.model(), e);
        }
    }

    private Map<String, Object> envelope(Map<String, Object> params) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jsonrpc", "2.0");
        payload.put("method", "call");
        payload.put("params", params);
        payload.put("id", requestIds.incrementAndGet());
        return payload;
    }

    private ResponseEntity<String> post(String path, Map<String, Object> payload, String sessionId) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode JSON-RPC request", e);
        }
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (sessionId != null) {
                            h.add(HttpHeaders.COOKIE, SESSION_COOKIE + "=" + sessionId);
                        }
                    })
                    .body(json)
                    .retrieve()
                    .toEntity(String.class);
        } catch (RestClientException e) {
            throw new RemoteTransportException("Odoo call " + path + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode readBody(String body) {
        if (body == null || body.isBlank()) {
            throw new RemoteTransportException("Empty response body from Odoo");
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new RemoteTransportException("Odoo response is not a JSON-RPC object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new RemoteTransportException("Malformed JSON from Odoo", e);
        }
    }

    private static String errorMessage(JsonNode error) {
        String message = error.path("data").path("message").asText("");
        if (message.isBlank()) {
            message = error.path("message").asText("unknown error");
        }
        return message;
    }

    static String sessionCookie(HttpHeaders headers) {
        List<String> cookies = headers.get(HttpHeaders.SET_COOKIE);
        if (cookies == null) {
            return null;
        }
        for (String cookie : cookies) {
            String pair = cookie.split(";", 2)[0].trim();
            if (pair.startsWith(SESSION_COOKIE + "=")) {
                String value = pair.substring(SESSION_COOKIE.length() + 1);
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private static final class SessionExpiredException extends RuntimeException {
        SessionExpiredException(String message) {
            super(message);
        }
    }
}
