/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.environment;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import io.opencensus.proto.agent.common.v1.LibraryInfo;

/**
 * Define LibraryInfo for this exporter
 */
final class ExporterLibrary {
  static final String VERSION;

  static final LibraryInfo LIBRARY_INFO;

  static {
    try (InputStream stream = ExporterLibrary.class.getResourceAsStream("exporter.properties")) {
      if (stream != null) {
        Properties props = new Properties();
        props.load(stream);
        VERSION = props.getProperty("version", "unknown");
      } else {
        VERSION = "unknown";
      }
      LIBRARY_INFO = LibraryInfo.newBuilder()
          .setLanguage(LibraryInfo.Language.JAVA)
          .setExporterVersion(VERSION)
          .setCoreLibraryVersion(VERSION)
          .build();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static LibraryInfo libraryInfo() {
    return LIBRARY_INFO;
  }

  private ExporterLibrary() {
  }
}
