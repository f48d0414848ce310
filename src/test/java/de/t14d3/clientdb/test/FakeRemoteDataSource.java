package de.t14d3.clientdb.test;

import com.fasterxml.jackson.databind.JsonNode;
import de.t14d3.clientdb.remote.RemoteDataSource;
import de.t14d3.clientdb.remote.RemoteMethod;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Canned responses keyed by verb and path; records every request.
 * Unknown paths answer {@code null}, like a 404.
 */
public class FakeRemoteDataSource implements RemoteDataSource {
    private final Map<String, JsonNode> responses = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch gate;
    private volatile CountDownLatch entered;

    public FakeRemoteDataSource respond(String path, JsonNode response) {
        return respond(RemoteMethod.GET, path, response);
    }

    public FakeRemoteDataSource respond(RemoteMethod method, String path, JsonNode response) {
        responses.put(method + " " + path, response);
        return this;
    }

    @Override
    public JsonNode request(RemoteMethod method, String path, JsonNode body) {
        calls.add(method + " " + path);
        CountDownLatch currentGate = gate;
        if (currentGate != null) {
            entered.countDown();
            try {
                if (!currentGate.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Held request was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        return responses.get(method + " " + path);
    }

    /**
     * Block every following request until {@link #release()}.
     */
    public void holdRequests() {
        entered = new CountDownLatch(1);
        gate = new CountDownLatch(1);
    }

    public void awaitEntered() throws InterruptedException {
        if (!entered.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("No request arrived");
        }
    }

    public void release() {
        CountDownLatch currentGate = gate;
        gate = null;
        currentGate.countDown();
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public long callCount(String path) {
        return callCount(RemoteMethod.GET, path);
    }

    public long callCount(RemoteMethod method, String path) {
        String key = method + " " + path;
        return calls.stream().filter(key::equals).count();
    }
}
