package org.auditfile.util.source;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Opens an audit file that is either plain XML, a ZIP archive with an XML member or
 * a GZIP compressed document. The container kind is detected from the leading bytes.
 * Compressed content is decompressed on the fly; no temporary files are written.
 */
public final class SourceReader {
  private static final Logger log = LogManager.getLogger(SourceReader.class);

  private static final int BUFFER_SIZE = 64 * 1024;

  private SourceReader() {
    throw new UnsupportedOperationException("SourceReader");
  }

  /**
   * Open source.
   * @param path file to open
   * @return handle that must be closed by the caller
   * @throws SourceFormatException if the path is unreadable or the archive has no XML member
   */
  public static SourceHandle open(Path path) {
    if (path == null || !Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new SourceFormatException("Source is not a readable file: " + path);
    }
    try {
      switch (detect(path)) {
        case ZIP:
          return openZip(path);
        case GZIP:
          return openGzip(path);
        default:
          return new SourceHandle(new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE),
              null, SourceHandle.Format.XML, path.toString());
      }
    } catch (IOException e) {
      throw new SourceFormatException("Cannot open " + path + ": " + e.getMessage(), e);
    }
  }

  static SourceHandle.Format detect(Path path) throws IOException {
    byte[] magic = new byte[4];
    int n;
    try (InputStream in = Files.newInputStream(path)) {
      n = in.readNBytes(magic, 0, magic.length);
    }
    if (n >= 4 && magic[0] == 'P' && magic[1] == 'K' && magic[2] == 3 && magic[3] == 4) {
      return SourceHandle.Format.ZIP;
    }
    if (n >= 2 && (magic[0] & 0xff) == 0x1f && (magic[1] & 0xff) == 0x8b) {
      return SourceHandle.Format.GZIP;
    }
    return SourceHandle.Format.XML;
  }

  static SourceHandle openZip(Path path) throws IOException {
    ZipFile zipFile = new ZipFile(path.toFile());
    try {
      List<ZipEntry> members = xmlMembers(zipFile);
      if (members.isEmpty()) {
        throw new SourceFormatException("No .xml member in archive " + path);
      }
      if (members.size() > 1) {
        log.warn("Archive {} has {} XML members; using {}", path, members.size(),
            members.get(0).getName());
      }
      ZipEntry entry = members.get(0);
      InputStream in = new BufferedInputStream(zipFile.getInputStream(entry), BUFFER_SIZE);
      return new SourceHandle(in, zipFile, SourceHandle.Format.ZIP,
          path + "!" + entry.getName());
    } catch (IOException | RuntimeException e) {
      zipFile.close();
      throw e;
    }
  }

  static List<ZipEntry> xmlMembers(ZipFile zipFile) {
    List<ZipEntry> members = new ArrayList<>();
    Enumeration<? extends ZipEntry> entries = zipFile.entries();
    while (entries.hasMoreElements()) {
      ZipEntry entry = entries.nextElement();
      if (!entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".xml")) {
        members.add(entry);
      }
    }
    return members;
  }

  static SourceHandle openGzip(Path path) throws IOException {
    InputStream raw = Files.newInputStream(path);
    try {
      InputStream in = new BufferedInputStream(new GZIPInputStream(raw, BUFFER_SIZE), BUFFER_SIZE);
      return new SourceHandle(in, raw, SourceHandle.Format.GZIP, path.toString());
    } catch (IOException e) {
      raw.close();
      throw e;
    }
  }
}
