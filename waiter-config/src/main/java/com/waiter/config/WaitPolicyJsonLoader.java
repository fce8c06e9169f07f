package com.waiter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waiter.core.ExceptionMatcher;
import com.waiter.core.WaitPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Minimal JSON loader for wait policies. Durations are numbers of seconds.
 *
 * <pre>
 * { "timeout": 1.5, "maxAttempts": 3, "interval": 0.1,
 *   "exponential": true, "maxInterval": 2, "ignore": ["java.io.IOException"] }
 * </pre>
 *
 * Misconfigured limits surface as the same exceptions {@link WaitPolicy} throws when built in code.
 */
public final class WaitPolicyJsonLoader {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Set<String> FIELDS =
        Set.of("timeout", "maxAttempts", "interval", "exponential", "maxInterval", "ignore");

    private WaitPolicyJsonLoader() {}

    public static WaitPolicy load(Path filePath) throws IOException {
        Objects.requireNonNull(filePath, "filePath");
        try (InputStream in = Files.newInputStream(filePath)) {
            return load(in);
        }
    }

    public static WaitPolicy load(InputStream in) throws IOException {
        return parsePolicy(readRoot(in), "policy");
    }

    /** Reads {@code { "policies": { "<name>": { ... } } }}, preserving declaration order. */
    public static Map<String, WaitPolicy> loadAll(InputStream in) throws IOException {
        JsonNode root = readRoot(in);
        JsonNode policies = root.get("policies");
        if (policies == null || !policies.isObject()) throw new IOException("Missing object field 'policies'");

        Map<String, WaitPolicy> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = policies.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), parsePolicy(e.getValue(), e.getKey()));
        }
        return out;
    }

    public static Map<String, WaitPolicy> loadAll(Path filePath) throws IOException {
        Objects.requireNonNull(filePath, "filePath");
        try (InputStream in = Files.newInputStream(filePath)) {
            return loadAll(in);
        }
    }

    private static JsonNode readRoot(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        JsonNode root = OBJECT_MAPPER.readTree(in);
        if (root == null || !root.isObject()) throw new IOException("Wait policy document must be a JSON object");
        return root;
    }

    private static WaitPolicy parsePolicy(JsonNode node, String where) throws IOException {
        if (node == null || !node.isObject()) throw new IOException("Policy '" + where + "' must be a JSON object");
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String f = names.next();
            if (!FIELDS.contains(f)) throw new IOException("Unknown field '" + f + "' in policy '" + where + "'");
        }

        WaitPolicy.Builder b = WaitPolicy.builder();
        if (node.has("timeout")) b.timeout(seconds(node, "timeout", where));
        if (node.has("maxAttempts")) {
            JsonNode n = node.get("maxAttempts");
            if (!n.isIntegralNumber() || !n.canConvertToInt()) {
                throw new IOException("'maxAttempts' in policy '" + where + "' must be an integer");
            }
            b.maxAttempts(n.intValue());
        }
        if (node.has("interval")) b.interval(seconds(node, "interval", where));
        if (node.has("exponential")) {
            JsonNode n = node.get("exponential");
            if (!n.isBoolean()) throw new IOException("'exponential' in policy '" + where + "' must be a boolean");
            b.exponential(n.booleanValue());
        }
        if (node.has("maxInterval")) b.maxInterval(seconds(node, "maxInterval", where));
        if (node.has("ignore")) b.ignore(ExceptionMatcher.anyOf(exceptionTypes(node.get("ignore"), where)));
        return b.build();
    }

    private static Duration seconds(JsonNode node, String field, String where) throws IOException {
        JsonNode n = node.get(field);
        if (!n.isNumber()) throw new IOException("'" + field + "' in policy '" + where + "' must be a number of seconds");
        BigDecimal nanos = n.decimalValue().movePointRight(9);
        try {
            return Duration.ofNanos(nanos.setScale(0, RoundingMode.HALF_UP).longValueExact());
        } catch (ArithmeticException tooLarge) {
            throw new IOException("'" + field + "' in policy '" + where + "' is out of range: " + n.asText(), tooLarge);
        }
    }

    private static List<Class<? extends Exception>> exceptionTypes(JsonNode node, String where) throws IOException {
        if (!node.isArray()) throw new IOException("'ignore' in policy '" + where + "' must be an array of class names");
        List<Class<? extends Exception>> types = new ArrayList<>();
        for (JsonNode n : node) {
            if (!n.isTextual()) throw new IOException("'ignore' entries must be strings");
            types.add(exceptionType(n.asText()));
        }
        return types;
    }

    private static Class<? extends Exception> exceptionType(String className) throws IOException {
        Class<?> c;
        try {
            c = Class.forName(className, false, classLoader());
        } catch (ClassNotFoundException e) {
            throw new IOException("Unknown exception class: " + className, e);
        }
        if (!Exception.class.isAssignableFrom(c)) throw new IOException("Not an exception class: " + className);
        return c.asSubclass(Exception.class);
    }

    private static ClassLoader classLoader() {
        ClassLoader tccl = Thread.currentThread().getContextClassLoader();
        return tccl != null ? tccl : WaitPolicyJsonLoader.class.getClassLoader();
    }
}
