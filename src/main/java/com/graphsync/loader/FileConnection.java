package com.graphsync.loader;

import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class FileConnection implements DataConnection {
    @NonNull
    String loaderNodeKey;
    @NonNull
    Path filepath;

    @Override
    public ConnectionKind getKind() {
        return ConnectionKind.FILE;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("kind", "file");
        json.put("loaderNodeKey", loaderNodeKey);
        json.put("filepath", filepath.toString());
        return json;
    }
}
