package io.github.friendsincode.grimnir.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileAttachmentTest {

  @TempDir Path tempDir;

  @Test
  void contentIsDefensivelyCopiedOnConstruction() {
    byte[] bytes = {1, 2, 3};
    FileAttachment attachment = new FileAttachment("a.mp3", bytes, "audio/mpeg");
    bytes[0] = 9;

    assertThat(attachment.content()).containsExactly(1, 2, 3);
  }

  @Test
  void contentIsDefensivelyCopiedOnAccess() {
    FileAttachment attachment = new FileAttachment("a.mp3", new byte[] {1, 2, 3}, "audio/mpeg");
    attachment.content()[0] = 9;

    assertThat(attachment.content()).containsExactly(1, 2, 3);
  }

  @Test
  void equalityComparesContent() {
    FileAttachment first = new FileAttachment("a.mp3", new byte[] {1, 2}, "audio/mpeg");
    FileAttachment second = new FileAttachment("a.mp3", new byte[] {1, 2}, "audio/mpeg");

    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
    assertThat(first).isNotEqualTo(new FileAttachment("a.mp3", new byte[] {1, 3}, "audio/mpeg"));
  }

  @Test
  void toStringReportsSizeNotContent() {
    FileAttachment attachment = new FileAttachment("a.mp3", new byte[] {1, 2, 3}, "audio/mpeg");

    assertThat(attachment.toString()).contains("a.mp3").contains("size=3").contains("audio/mpeg");
  }

  @Test
  void blankFilenameIsRejected() {
    assertThatThrownBy(() -> new FileAttachment(" ", new byte[0], "audio/mpeg"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nullContentThrowsNullPointerException() {
    assertThatThrownBy(() -> new FileAttachment("a.mp3", null, "audio/mpeg"))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("content");
  }

  @Test
  void fromPathReadsFileAndUsesItsName() throws IOException {
    Path file = tempDir.resolve("jingle.mp3");
    Files.write(file, "ID3data".getBytes(StandardCharsets.UTF_8));

    FileAttachment attachment = FileAttachment.fromPath(file, "audio/mpeg");

    assertThat(attachment.filename()).isEqualTo("jingle.mp3");
    assertThat(new String(attachment.content(), StandardCharsets.UTF_8)).isEqualTo("ID3data");
    assertThat(attachment.mimeType()).isEqualTo("audio/mpeg");
  }

  @Test
  void fromPathPropagatesMissingFile() {
    assertThatThrownBy(() -> FileAttachment.fromPath(tempDir.resolve("missing.mp3"), "audio/mpeg"))
        .isInstanceOf(IOException.class);
  }
}
