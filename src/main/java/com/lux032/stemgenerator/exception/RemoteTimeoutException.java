package com.lux032.stemgenerator.exception;

/**
 * 远程任务轮询超过上限
 */
public class RemoteTimeoutException extends SeparationFailureException {

    private final long timeoutSeconds;

    public RemoteTimeoutException(String engineName, long timeoutSeconds) {
        super("Remote job did not finish within " + timeoutSeconds + "s", engineName);
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
