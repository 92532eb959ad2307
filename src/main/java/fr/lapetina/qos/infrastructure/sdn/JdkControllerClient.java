package fr.lapetina.qos.infrastructure.sdn;

import fr.lapetina.qos.domain.exception.ConfigurationExecutionException;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.infrastructure.config.QosConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * {@link ControllerClient} over {@code java.net.http.HttpClient} with HTTP basic authentication.
 */
public final class JdkControllerClient implements ControllerClient {

    private static final Logger log = LoggerFactory.getLogger(JdkControllerClient.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String authorization;
    private final Duration requestTimeout;

    public JdkControllerClient(String baseUrl, String username, String password, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.authorization = username != null
                ? "Basic " + Base64.getEncoder().encodeToString(
                        (username + ":" + (password != null ? password : "")).getBytes(StandardCharsets.UTF_8))
                : null;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public static JdkControllerClient fromConfig(QosConfig.SdnConfig config) {
        return new JdkControllerClient(config.getBaseUrl(), config.getUsername(), config.getPassword(),
                Duration.ofMillis(config.getRequestTimeoutMs()));
    }

    @Override
    public ControllerResponse send(ControllerRequest request) {
        HttpRequest httpRequest = buildHttpRequest(request);
        log.debug("Controller call: method={}, uri={}", request.method(), httpRequest.uri());
        try {
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            return new ControllerResponse(response.statusCode(), response.body(),
                    response.headers().firstValue("Location").orElse(null));
        } catch (HttpTimeoutException e) {
            throw new ConfigurationExecutionException(ErrorType.TIMEOUT, baseUrl,
                    request.method() + " " + request.path() + " timed out", e);
        } catch (IOException e) {
            throw new ConfigurationExecutionException(ErrorType.CONTROLLER_ERROR, baseUrl,
                    request.method() + " " + request.path() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationExecutionException(ErrorType.CONTROLLER_ERROR, baseUrl,
                    "interrupted during " + request.method() + " " + request.path(), e);
        }
    }

    private HttpRequest buildHttpRequest(ControllerRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + request.path()))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        HttpRequest.BodyPublisher body = request.body() != null
                ? HttpRequest.BodyPublishers.ofString(request.body())
                : HttpRequest.BodyPublishers.noBody();
        if (request.body() != null) {
            builder.header("Content-Type", "application/json");
        }
        return switch (request.method()) {
            case GET -> builder.GET().build();
            case POST -> builder.POST(body).build();
            case PUT -> builder.PUT(body).build();
            case DELETE -> builder.DELETE().build();
        };
    }
}
