package com.scholary.voice.service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps a requested audio path onto the configured audio directory.
 *
 * <p>Relative paths are resolved against the directory. Anything that normalizes to a location
 * outside it, absolute paths included, is rejected.
 */
public class AudioPathResolver {

  private final Path baseDir;

  public AudioPathResolver(Path baseDir) {
    this.baseDir = baseDir.toAbsolutePath().normalize();
  }

  public Optional<Path> resolve(String requested) {
    if (requested == null || requested.isBlank()) {
      return Optional.empty();
    }
    Path resolved;
    try {
      resolved = baseDir.resolve(requested).normalize();
    } catch (InvalidPathException e) {
      return Optional.empty();
    }
    if (!resolved.startsWith(baseDir) || resolved.equals(baseDir)) {
      return Optional.empty();
    }
    return Optional.of(resolved);
  }

  public Path getBaseDir() {
    return baseDir;
  }
}
