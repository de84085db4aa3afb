package com.stashguard.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Allowlist of callable methods.
 *
 * Only explicitly registered methods can be called. Registration happens during bootstrap
 * and is closed before the transport starts accepting requests.
 */
public class RpcMethodRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(RpcMethodRegistry.class);

    private static final Pattern METHOD_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    private final Map<String, RpcMethod> methods = new ConcurrentHashMap<>();

    private volatile boolean registrationOpen = true;

    /**
     * Registers a method under its own name.
     *
     * @param method method implementation
     * @throws IllegalStateException if registration is closed
     * @throws IllegalArgumentException if the name is invalid or already taken
     */
    public void register(RpcMethod method) {
        if (!registrationOpen) {
            throw new IllegalStateException("Method registration is closed");
        }

        String name = method.name();
        if (name == null || !METHOD_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid method name: '" + name + "'");
        }
        if (methods.putIfAbsent(name, method) != null) {
            throw new IllegalArgumentException("Method '" + name + "' is already registered");
        }
        LOGGER.info("Registered RPC method: {}", name);
    }

    /**
     * Gets a registered method by name.
     *
     * @return the method, or null if none is registered
     */
    public RpcMethod get(String name) {
        return name == null ? null : methods.get(name);
    }

    public boolean has(String name) {
        return name != null && methods.containsKey(name);
    }

    /**
     * Closes registration - no more methods can be registered.
     */
    public void closeRegistration() {
        registrationOpen = false;
        LOGGER.info("Method registration closed. {} methods registered.", methods.size());
    }

    public boolean isRegistrationOpen() {
        return registrationOpen;
    }

    public Map<String, RpcMethod> getAllMethods() {
        return Map.copyOf(methods);
    }
}
