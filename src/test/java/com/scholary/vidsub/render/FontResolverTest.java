package com.scholary.vidsub.render;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class FontResolverTest {

  @TempDir Path tempDir;

  @Test
  void resolve_shouldFailWhenNoCandidateLoads() {
    FontProperties properties =
        new FontProperties(
            List.of("classpath:fonts/does-not-exist.ttf", "/nonexistent/NotoSansHebrew.ttf"),
            "שלום",
            100);
    FontResolver resolver = new FontResolver(properties, new DefaultResourceLoader());

    assertThatThrownBy(() -> resolver.resolve(28f))
        .isInstanceOf(FontResolutionException.class)
        .hasMessageContaining("does-not-exist.ttf");
  }

  @Test
  void resolve_shouldSkipFilesThatAreNotFonts() throws Exception {
    Path garbage = tempDir.resolve("broken.ttf");
    Files.write(garbage, new byte[] {1, 2, 3, 4, 5, 6, 7, 8});
    FontProperties properties = new FontProperties(List.of(garbage.toString()), "שלום", 100);
    FontResolver resolver = new FontResolver(properties, new DefaultResourceLoader());

    assertThatThrownBy(() -> resolver.resolve(28f)).isInstanceOf(FontResolutionException.class);
  }
}
