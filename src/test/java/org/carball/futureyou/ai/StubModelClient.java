package org.carball.futureyou.ai;

import org.carball.futureyou.TestFixtures;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deterministic {@link ModelClient}. Replays queued responses in order (a queued
 * {@link RuntimeException} is thrown instead of returned), and once the queue is empty
 * answers from canned fixtures chosen by the prompt's opening line. Every call is recorded.
 */
public class StubModelClient implements ModelClient {

    private final Deque<Object> queued = new ArrayDeque<>();
    private final List<String> prompts = new ArrayList<>();
    private final List<String> modelNames = new ArrayList<>();
    private boolean routeWhenEmpty = true;

    public static StubModelClient routing() {
        return new StubModelClient();
    }

    /**
     * Replays exactly the given responses; a call beyond them fails the test.
     */
    public static StubModelClient sequence(Object... responses) {
        StubModelClient client = new StubModelClient();
        client.queued.addAll(Arrays.asList(responses));
        client.routeWhenEmpty = false;
        return client;
    }

    /**
     * Queues responses ahead of the routed fixtures.
     */
    public StubModelClient then(Object... responses) {
        queued.addAll(Arrays.asList(responses));
        return this;
    }

    @Override
    public synchronized String generate(String prompt, String modelName) {
        prompts.add(prompt);
        modelNames.add(modelName);

        if (!queued.isEmpty()) {
            Object next = queued.poll();
            if (next instanceof RuntimeException) {
                throw (RuntimeException) next;
            }
            return (String) next;
        }
        if (!routeWhenEmpty) {
            throw new AssertionError("Unexpected model call #" + prompts.size());
        }
        return route(prompt);
    }

    public int callCount() {
        return prompts.size();
    }

    public List<String> getPrompts() {
        return prompts;
    }

    public String lastPrompt() {
        return prompts.get(prompts.size() - 1);
    }

    public List<String> getModelNames() {
        return modelNames;
    }

    public long callsStartingWith(String prefix) {
        return prompts.stream().filter(p -> p.startsWith(prefix)).count();
    }

    private static String route(String prompt) {
        if (prompt.startsWith("Analyze this user profile")) {
            return TestFixtures.DNA_JSON;
        }
        if (prompt.startsWith("Simulate")) {
            return "```json\n" + TestFixtures.scenariosJson() + "\n```";
        }
        if (prompt.startsWith("Analyze these future scenarios")) {
            List<String> ids = scenarioIds(prompt);
            return TestFixtures.analysisJson(ids.get(0), ids);
        }
        if (prompt.startsWith("Based on this analysis")) {
            return TestFixtures.ADVICE;
        }
        throw new AssertionError("No canned response for prompt: " + prompt);
    }

    private static List<String> scenarioIds(String prompt) {
        String marker = "Valid scenario ids: ";
        int start = prompt.indexOf(marker) + marker.length();
        int end = prompt.indexOf('\n', start);
        return Arrays.stream(prompt.substring(start, end).split(","))
                .map(String::trim)
                .collect(Collectors.toList());
    }
}
