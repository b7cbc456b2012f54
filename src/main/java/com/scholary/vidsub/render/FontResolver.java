package com.scholary.vidsub.render;

import java.awt.Font;
import java.awt.FontFormatException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Resolves the subtitle font from an ordered list of candidates.
 *
 * <p>Runs once at startup. Candidates that are missing, unreadable, or lack glyphs for the probe
 * text are skipped. If none qualifies, startup fails with a {@link FontResolutionException} instead
 * of rendering boxes later.
 */
@Component
public class FontResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(FontResolver.class);

  private static final String CLASSPATH_PREFIX = "classpath:";
  private static final String FAMILY_PREFIX = "family:";

  private final FontProperties properties;
  private final ResourceLoader resourceLoader;

  public FontResolver(FontProperties properties, ResourceLoader resourceLoader) {
    this.properties = properties;
    this.resourceLoader = resourceLoader;
  }

  /**
   * Resolve the first usable candidate.
   *
   * @param size point size of the returned font
   * @return the font, derived to {@code size}
   * @throws FontResolutionException if no candidate can display the probe text
   */
  public Font resolve(float size) {
    return resolve(properties.candidates(), size);
  }

  /** Resolve from an explicit candidate list, e.g. when retrying with a fallback font. */
  public Font resolve(List<String> candidates, float size) {
    for (String candidate : candidates) {
      Optional<Font> font = load(candidate.trim());
      if (font.isEmpty()) {
        continue;
      }
      int missing = font.get().canDisplayUpTo(properties.probeText());
      if (missing != -1) {
        LOGGER.info(
            "Skipping font candidate {}: no glyph for '{}'",
            candidate,
            properties.probeText().charAt(missing));
        continue;
      }
      LOGGER.info("Resolved subtitle font: {} ({})", font.get().getFontName(), candidate);
      return font.get().deriveFont(size);
    }

    throw new FontResolutionException(
        String.format(
            "No font candidate can display '%s'; tried %s", properties.probeText(), candidates));
  }

  private Optional<Font> load(String candidate) {
    try {
      if (candidate.startsWith(FAMILY_PREFIX)) {
        return loadFamily(candidate.substring(FAMILY_PREFIX.length()));
      }
      if (candidate.startsWith(CLASSPATH_PREFIX)) {
        return loadResource(resourceLoader.getResource(candidate));
      }
      return loadFile(Path.of(candidate));
    } catch (IOException | FontFormatException e) {
      LOGGER.warn("Failed to load font candidate {}: {}", candidate, e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<Font> loadResource(Resource resource) throws IOException, FontFormatException {
    if (!resource.exists()) {
      LOGGER.debug("Bundled font not found: {}", resource.getDescription());
      return Optional.empty();
    }
    try (InputStream in = resource.getInputStream()) {
      return Optional.of(Font.createFont(Font.TRUETYPE_FONT, in));
    }
  }

  private Optional<Font> loadFile(Path path) throws IOException, FontFormatException {
    if (!Files.isRegularFile(path)) {
      LOGGER.debug("Font file not found: {}", path);
      return Optional.empty();
    }
    return Optional.of(Font.createFont(Font.TRUETYPE_FONT, path.toFile()));
  }

  private Optional<Font> loadFamily(String family) {
    Font font = new Font(family, Font.PLAIN, 1);
    // AWT silently substitutes Dialog for unknown families
    if (!font.getFamily().equalsIgnoreCase(family)) {
      LOGGER.debug("Font family not installed: {}", family);
      return Optional.empty();
    }
    return Optional.of(font);
  }
}
