package io.github.friendsincode.grimnir.client;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single file sent as the {@code file} part of a multipart upload.
 *
 * <p>The content is defensively copied on construction and on access.
 *
 * @param filename the file name reported to the backend
 * @param content the raw file bytes
 * @param mimeType the part content type (e.g. {@code audio/mpeg})
 */
public record FileAttachment(String filename, byte[] content, String mimeType) {

  /** Validates non-null fields and copies the content. */
  public FileAttachment {
    Objects.requireNonNull(filename, "filename");
    content = Objects.requireNonNull(content, "content").clone();
    Objects.requireNonNull(mimeType, "mimeType");
    if (filename.isBlank()) {
      throw new IllegalArgumentException("filename must not be blank");
    }
  }

  /**
   * Reads a file from disk.
   *
   * @param path the file to read
   * @param mimeType the part content type
   * @return an attachment named after the file's last path element
   * @throws IOException if the file cannot be read
   */
  public static FileAttachment fromPath(Path path, String mimeType) throws IOException {
    Objects.requireNonNull(path, "path");
    Path fileName = path.getFileName();
    if (fileName == null) {
      throw new IllegalArgumentException("path has no file name: " + path);
    }
    return new FileAttachment(fileName.toString(), Files.readAllBytes(path), mimeType);
  }

  @Override
  public byte[] content() {
    return content.clone();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof FileAttachment that
        && filename.equals(that.filename)
        && Arrays.equals(content, that.content)
        && mimeType.equals(that.mimeType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(filename, Arrays.hashCode(content), mimeType);
  }

  @Override
  public String toString() {
    return "FileAttachment[filename="
        + filename
        + ", size="
        + content.length
        + ", mimeType="
        + mimeType
        + "]";
  }
}
