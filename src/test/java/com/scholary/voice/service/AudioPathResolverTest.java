package com.scholary.voice.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AudioPathResolverTest {

  @TempDir Path audioDir;

  @Test
  void resolve_shouldResolveRelativePathInsideDirectory() {
    AudioPathResolver resolver = new AudioPathResolver(audioDir);

    assertThat(resolver.resolve("talks/intro.flac"))
        .contains(audioDir.toAbsolutePath().normalize().resolve("talks/intro.flac"));
  }

  @Test
  void resolve_shouldAcceptAbsolutePathInsideDirectory() {
    AudioPathResolver resolver = new AudioPathResolver(audioDir);
    Path inside = audioDir.toAbsolutePath().resolve("talk.wav");

    assertThat(resolver.resolve(inside.toString())).contains(inside.normalize());
  }

  @Test
  void resolve_shouldRejectParentTraversal() {
    AudioPathResolver resolver = new AudioPathResolver(audioDir);

    assertThat(resolver.resolve("../outside.flac")).isEmpty();
    assertThat(resolver.resolve("talks/../../outside.flac")).isEmpty();
  }

  @Test
  void resolve_shouldRejectAbsolutePathOutsideDirectory() {
    AudioPathResolver resolver = new AudioPathResolver(audioDir);

    assertThat(resolver.resolve("/etc/passwd")).isEmpty();
  }

  @Test
  void resolve_shouldRejectDirectoryItselfAndBlankPath() {
    AudioPathResolver resolver = new AudioPathResolver(audioDir);

    assertThat(resolver.resolve(".")).isEmpty();
    assertThat(resolver.resolve(" ")).isEmpty();
  }

  @Test
  void resolve_shouldRejectSiblingDirectoryWithSamePrefix() {
    AudioPathResolver resolver = new AudioPathResolver(audioDir.resolve("audio"));

    assertThat(resolver.resolve("../audio-private/secret.flac")).isEmpty();
  }
}
