package com.graphsync.loader;

import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class ApiConnection implements DataConnection {
    @NonNull
    String loaderNodeKey;
    @NonNull
    String baseUrl;

    @Override
    public ConnectionKind getKind() {
        return ConnectionKind.API;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("kind", "api");
        json.put("loaderNodeKey", loaderNodeKey);
        json.put("baseUrl", baseUrl);
        return json;
    }
}
