package io.github.samzhu.timesheet.exception;

/**
 * Asana 拒絕請求 (400 等其他 4xx)，重試也不會成功。
 *
 * <p>該專案直接略過。
 */
public class AsanaRequestException extends RuntimeException {

    private final int statusCode;

    public AsanaRequestException(String path, int statusCode) {
        super("Asana rejected request: " + path + " (HTTP " + statusCode + ")");
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
