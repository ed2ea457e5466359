package com.localedata.assembler.emit;

import java.io.IOException;
import java.nio.file.Path;

import com.localedata.assembler.util.FileWriteUtil;

/**
 * Writes one artifact to storage.
 */
@FunctionalInterface
public interface ArtifactWriter {

    ArtifactWriter FILE_SYSTEM = FileWriteUtil::safeWriteString;

    void write(Path path, String content) throws IOException;
}
