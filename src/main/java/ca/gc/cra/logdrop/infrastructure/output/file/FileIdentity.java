package ca.gc.cra.logdrop.infrastructure.output.file;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem identity of an existing file: the platform file key (device and inode on POSIX), or the real path
 * when the platform exposes no key. Hard links and symlinks to one file yield equal identities.
 *
 * @param key platform file key or real path
 * @since 0.1.0
 */
record FileIdentity(Object key) {
  private static final Logger log = LoggerFactory.getLogger(FileIdentity.class);
  private static final AtomicBoolean FALLBACK_LOGGED = new AtomicBoolean();

  FileIdentity {
    Objects.requireNonNull(key, "key");
  }

  /**
   * Resolves the identity of an existing file.
   *
   * @param path file to inspect; must exist
   * @return identity shared by every path naming the same file
   * @throws IOException if the file cannot be inspected
   */
  static FileIdentity of(Path path) throws IOException {
    BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
    Object fileKey = attributes.fileKey();
    if (fileKey != null) {
      return new FileIdentity(fileKey);
    }
    if (FALLBACK_LOGGED.compareAndSet(false, true)) {
      log.debug("Platform exposes no file keys; identifying files by real path");
    }
    return new FileIdentity(path.toRealPath());
  }
}
