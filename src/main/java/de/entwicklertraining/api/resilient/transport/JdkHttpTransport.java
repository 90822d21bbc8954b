package de.entwicklertraining.api.resilient.transport;

import de.entwicklertraining.api.resilient.ApiHttpConfiguration;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link HttpTransport} backed by the JDK's {@link HttpClient}.
 * <p>
 * The response body is always read as a string, for success and error responses alike.
 * Request modifiers from {@link ApiHttpConfiguration} are applied to every
 * {@link HttpRequest.Builder} after the request headers were set.
 */
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;
    private final List<Consumer<HttpRequest.Builder>> requestModifiers;

    /**
     * Creates a transport with a default {@link HttpClient} and no request modifiers.
     */
    public JdkHttpTransport() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(), new ApiHttpConfiguration());
    }

    /**
     * Creates a transport with a default {@link HttpClient} and the given configuration.
     *
     * @param httpConfig Supplies the request modifiers to apply
     */
    public JdkHttpTransport(ApiHttpConfiguration httpConfig) {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(), httpConfig);
    }

    /**
     * Creates a transport on top of an existing {@link HttpClient}.
     *
     * @param httpClient The client to send requests with
     * @param httpConfig Supplies the request modifiers to apply
     */
    public JdkHttpTransport(HttpClient httpClient, ApiHttpConfiguration httpConfig) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestModifiers = Objects.requireNonNull(httpConfig, "httpConfig").getRequestModifiers();
    }

    @Override
    public AttemptResult send(TransportRequest request) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(request.uri());

        request.headers().forEach(builder::header);
        request.timeout().ifPresent(builder::timeout);

        HttpRequest.BodyPublisher publisher;
        if (request.body().isPresent()) {
            if (request.headers().keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
                builder.header("Content-Type", "application/json");
            }
            publisher = HttpRequest.BodyPublishers.ofString(request.body().get());
        } else {
            publisher = HttpRequest.BodyPublishers.noBody();
        }
        builder.method(request.method().name(), publisher);

        requestModifiers.forEach(modifier -> modifier.accept(builder));

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        return new AttemptResult(response.statusCode(), response.headers(), response.body());
    }
}
