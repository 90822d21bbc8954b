package de.entwicklertraining.api.resilient;

import de.entwicklertraining.api.resilient.transport.AttemptResult;
import de.entwicklertraining.api.resilient.transport.HttpTransport;
import de.entwicklertraining.api.resilient.transport.TransportRequest;
import java.io.IOException;
import java.net.http.HttpHeaders;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * In-memory transport replaying a script of responses and failures, one per attempt.
 * The last step repeats once the script is used up.
 */
class ScriptedTransport implements HttpTransport {

    private final Deque<Object> steps = new ArrayDeque<>();
    private final List<TransportRequest> requests = new ArrayList<>();
    private Object lastStep;

    ScriptedTransport respond(int status, String body) {
        steps.add(AttemptResult.of(status, body));
        return this;
    }

    ScriptedTransport respond(int status, String body, Map<String, List<String>> headers) {
        steps.add(new AttemptResult(status, HttpHeaders.of(headers, (name, value) -> true), body));
        return this;
    }

    ScriptedTransport fail(IOException error) {
        steps.add(error);
        return this;
    }

    @Override
    public synchronized AttemptResult send(TransportRequest request) throws IOException {
        requests.add(request);
        Object step = steps.isEmpty() ? lastStep : steps.poll();
        if (step == null) {
            throw new IllegalStateException("Transport script is empty");
        }
        lastStep = step;
        if (step instanceof IOException) {
            throw (IOException) step;
        }
        return (AttemptResult) step;
    }

    synchronized int getCallCount() {
        return requests.size();
    }

    synchronized List<TransportRequest> getRequests() {
        return new ArrayList<>(requests);
    }
}
