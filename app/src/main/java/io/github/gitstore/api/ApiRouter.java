package io.github.gitstore.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Named request handlers. A request carries a JSON payload decoded into the handler's input type; the reply is an
 * {@link ApiResponse} encoded as JSON. A failing handler yields its error message in the envelope and no result.
 */
public class ApiRouter {
    private static final Logger logger = LogManager.getLogger(ApiRouter.class);

    @FunctionalInterface
    public interface ApiHandler<I, O> {
        @Nullable
        O handle(I input) throws Exception;
    }

    /** Input type of handlers that take no parameters. */
    public record NoInput() {}

    private record Route(JavaType inputType, ApiHandler<Object, ?> handler) {}

    private final ObjectMapper mapper;
    private final Map<String, Route> routes = new ConcurrentHashMap<>();

    public ApiRouter() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <I> void listen(String name, Class<I> inputType, ApiHandler<I, ?> handler) {
        listen(name, mapper.constructType(inputType), handler);
    }

    @SuppressWarnings("unchecked")
    public <I> void listen(String name, JavaType inputType, ApiHandler<I, ?> handler) {
        var route = new Route(inputType, (ApiHandler<Object, ?>) (ApiHandler<?, ?>) handler);
        if (routes.putIfAbsent(name, route) != null) {
            throw new IllegalArgumentException("Handler already registered for " + name);
        }
        logger.debug("Listening for {}", name);
    }

    public Set<String> names() {
        return new TreeSet<>(routes.keySet());
    }

    /** Handles one request, returning the JSON-encoded reply. */
    public String handle(String name, @Nullable String jsonInput) {
        try {
            return mapper.writeValueAsString(dispatch(name, jsonInput));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode reply to " + name, e);
        }
    }

    public ApiResponse dispatch(String name, @Nullable String jsonInput) {
        var route = routes.get(name);
        if (route == null) {
            logger.warn("No handler registered for {}", name);
            return ApiResponse.failure("Unknown request: " + name);
        }
        try {
            var json = jsonInput == null || jsonInput.isBlank() ? "{}" : jsonInput;
            Object input = mapper.readValue(json, route.inputType());
            return ApiResponse.success(route.handler().handle(input));
        } catch (Exception e) {
            logger.error("Handler for {} failed", name, e);
            return ApiResponse.failure(e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }
}
