package dev.jane.mcp.utility;

import dev.jane.mcp.exception.IoException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;

public class FileUtility {

  public static void deleteDir(Path dir, boolean quietly) {
    try {
      if (Files.exists(dir)) {
        try (var paths = Files.walk(dir)) {
          paths
              .sorted(Comparator.reverseOrder()) // delete children first
              .forEach(
                  path -> {
                    try {
                      Files.delete(path);
                    } catch (IOException e) {
                      throw new IoException("Failed to delete file: " + path, e);
                    }
                  });
        }
      }
    } catch (Exception e) {
      if (!quietly) {
        throw new IoException("Failed to delete directory: " + dir, e);
      }
    }
  }

  /**
   * Write {@code content} to {@code target} so that readers see either the old or the new file,
   * never a partially written one. The data lands in a temporary sibling first and is then moved
   * over the target, atomically where the filesystem supports it.
   */
  public static void writeAtomically(Path target, String content) {
    Path parent = target.toAbsolutePath().getParent();
    Path temp = null;
    try {
      Files.createDirectories(parent);
      temp = Files.createTempFile(parent, ".jane-", ".tmp");
      Files.writeString(temp, content, StandardCharsets.UTF_8);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException e) {
      throw new IoException("Failed to write file: " + target, e);
    } finally {
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException ignored) {
          // the original failure is already being reported
        }
      }
    }
  }
}
