package com.example.portalsync.support;

import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Captured portal pages under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

  private Fixtures() {
  }

  public static String read(String name) {
    try (InputStream in = new ClassPathResource("fixtures/" + name).getInputStream()) {
      return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Missing fixture " + name, e);
    }
  }
}
