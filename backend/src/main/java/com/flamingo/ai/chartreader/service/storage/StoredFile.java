package com.flamingo.ai.chartreader.service.storage;

import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import java.nio.file.Path;

/**
 * A job's source file as found on disk.
 *
 * @param path absolute or working-directory relative path to the file
 * @param location which storage directory holds it
 */
public record StoredFile(Path path, FileLocation location) {}
