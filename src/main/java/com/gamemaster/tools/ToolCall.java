package com.gamemaster.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class ToolCall {

    private final String name;
    private final Map<String, String> args;

    public ToolCall(String name, Map<String, String> args) {
        this.name = name;
        this.args = args == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getArgs() {
        return args;
    }

    public String arg(String key) {
        return args.get(key);
    }
}
