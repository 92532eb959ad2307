package fr.lapetina.qos.infrastructure.sdn;

/**
 * @param location value of the {@code Location} header, null when absent
 */
public record ControllerResponse(int statusCode, String body, String location) {

    public ControllerResponse {
        body = body != null ? body : "";
    }

    public static ControllerResponse of(int statusCode, String body) {
        return new ControllerResponse(statusCode, body, null);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
