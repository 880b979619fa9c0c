package com.graphsync.engine;

import com.graphsync.exception.SourceDataException;
import com.graphsync.loader.DataConnection;
import com.graphsync.loader.FileConnection;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Arguments of one sync job.
 */
@Value
@Builder
public class JobArgs {

    static final int MAX_REVISION_HEADER_LENGTH = 400;

    @NonNull
    DataConnection connection;
    @NonNull
    String containerKey;
    @Builder.Default
    boolean enableDelete = true;
    @NonNull
    @Builder.Default
    String revisionHeader = "graphsync";
    /**
     * Where the tree snapshot is written, if anywhere.
     */
    Path outputDir;

    public void validate() {
        if (connection instanceof FileConnection file && !Files.isRegularFile(file.getFilepath())) {
            throw new SourceDataException("Source file not found", file.getFilepath());
        }
    }

    /**
     * Revision header as used in changeset comments.
     */
    public String getCommentHeader() {
        return revisionHeader.length() > MAX_REVISION_HEADER_LENGTH
                ? revisionHeader.substring(0, MAX_REVISION_HEADER_LENGTH)
                : revisionHeader;
    }
}
