package io.github.samzhu.timesheet.exception;

/**
 * Asana 回應 404：專案或任務已刪除，或 Token 沒有權限看到它。
 *
 * <p>不重試，該專案直接略過。
 */
public class AsanaNotFoundException extends RuntimeException {

    public AsanaNotFoundException(String path) {
        super("Asana resource not found: " + path);
    }
}
