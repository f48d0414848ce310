package de.t14d3.clientdb.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.clientdb.exceptions.RemoteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * JSON over HTTP. Paths are resolved against the base URI; 404 is reported as a missing object.
 */
public class HttpRemoteDataSource implements RemoteDataSource {
    private static final Logger log = LoggerFactory.getLogger(HttpRemoteDataSource.class);

    private final HttpClient client;
    private final URI baseUri;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpRemoteDataSource(URI baseUri) {
        this(HttpClient.newHttpClient(), baseUri, new ObjectMapper(), null);
    }

    /**
     * @param requestTimeout per-request timeout, {@code null} for none
     */
    public HttpRemoteDataSource(HttpClient client, URI baseUri, ObjectMapper objectMapper, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.baseUri = normalize(Objects.requireNonNull(baseUri, "baseUri"));
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.requestTimeout = requestTimeout;
    }

    @Override
    public JsonNode request(RemoteMethod method, String path, JsonNode body) {
        URI uri = baseUri.resolve(path.startsWith("/") ? path.substring(1) : path);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Accept", "application/json")
                .method(method.name(), bodyPublisher(body));
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteException(method + " " + uri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteException(method + " " + uri + " interrupted", e);
        }

        int status = response.statusCode();
        log.debug("{} {} -> {}", method, uri, status);
        if (status == 404) {
            return null;
        }
        if (status < 200 || status >= 300) {
            throw new RemoteException(method + " " + uri + " returned " + status, status);
        }
        String text = response.body();
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            return node == null || node.isNull() ? null : node;
        } catch (JsonProcessingException e) {
            throw new RemoteException("Invalid JSON from " + method + " " + uri, e);
        }
    }

    private HttpRequest.BodyPublisher bodyPublisher(JsonNode body) {
        if (body == null) {
            return HttpRequest.BodyPublishers.noBody();
        }
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new RemoteException("Failed to serialize request body", e);
        }
    }

    private static URI normalize(URI uri) {
        String text = uri.toString();
        return text.endsWith("/") ? uri : URI.create(text + "/");
    }
}
