package com.agentdeck.core.permission;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * Full-precision modification time and size of a file, used to notice edits made
 * since the file was last read. A missing or unreadable file has a null time.
 */
record FileStamp(FileTime modified, long size) {

    static final FileStamp NONE = new FileStamp(null, -1L);

    static FileStamp of(Path file) {
        try {
            return Files.exists(file) ? new FileStamp(Files.getLastModifiedTime(file), Files.size(file)) : NONE;
        } catch (IOException e) {
            return NONE;
        }
    }

    boolean exists() {
        return modified != null;
    }
}
