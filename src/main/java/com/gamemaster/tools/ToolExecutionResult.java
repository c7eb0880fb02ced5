package com.gamemaster.tools;

public class ToolExecutionResult {

    private final String tool;
    private final boolean ok;
    private final String text;
    private final String error;

    public ToolExecutionResult(String tool, boolean ok, String text, String error) {
        this.tool = tool;
        this.ok = ok;
        this.text = text;
        this.error = error;
    }

    public static ToolExecutionResult ok(String tool, String text) {
        return new ToolExecutionResult(tool, true, text, null);
    }

    public static ToolExecutionResult error(String tool, String text, String error) {
        return new ToolExecutionResult(tool, false, text, error);
    }

    public String getTool() {
        return tool;
    }

    public boolean isOk() {
        return ok;
    }

    public String getText() {
        return text;
    }

    public String getError() {
        return error;
    }
}
