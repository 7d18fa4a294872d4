package me.golemcore.resilience.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Terminal failure of a tool call after the retry policy gave up. The cause is
 * the error of the last attempt.
 */
public class ToolExecutionException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final int attempts;

    public ToolExecutionException(String toolName, int attempts, Throwable cause) {
        super("Tool '" + toolName + "' failed after " + attempts + (attempts == 1 ? " attempt: " : " attempts: ")
                + describe(cause), cause);
        this.toolName = toolName;
        this.attempts = attempts;
    }

    public String getToolName() {
        return toolName;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }
}
