package fr.lapetina.qos.infrastructure.sdn;

import java.util.Objects;

/**
 * One REST call to the controller.
 *
 * @param path path below the controller base URL, starting with '/'
 * @param body JSON document, null for GET and DELETE
 */
public record ControllerRequest(Method method, String path, String body) {

    public enum Method {
        GET,
        POST,
        PUT,
        DELETE;

        /**
         * GET is the only call retried on failure.
         */
        public boolean isIdempotentRead() {
            return this == GET;
        }
    }

    public ControllerRequest {
        Objects.requireNonNull(method, "Method is required");
        Objects.requireNonNull(path, "Path is required");
    }

    public static ControllerRequest get(String path) {
        return new ControllerRequest(Method.GET, path, null);
    }

    public static ControllerRequest post(String path, String body) {
        return new ControllerRequest(Method.POST, path, body);
    }

    public static ControllerRequest put(String path, String body) {
        return new ControllerRequest(Method.PUT, path, body);
    }

    public static ControllerRequest delete(String path) {
        return new ControllerRequest(Method.DELETE, path, null);
    }
}
