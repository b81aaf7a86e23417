package cafe.woden.ircengine.logging;

import cafe.woden.ircengine.model.ChatMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scrollback as JSON lines: {@code <baseDir>/<storageKey>/<target>.jsonl}.
 *
 * <p>Path components are sanitized so nicks and channel names can't escape the base directory.
 * One writer per file is assumed; sessions guarantee that by owning their storage key.
 */
public class JsonlScrollbackStore implements ScrollbackStore {

  private static final Logger log = LoggerFactory.getLogger(JsonlScrollbackStore.class);

  private final Path baseDir;
  private final ObjectMapper json;

  public JsonlScrollbackStore(Path baseDir, ObjectMapper json) throws IOException {
    this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    this.json = Objects.requireNonNull(json, "json");
    Files.createDirectories(baseDir);
  }

  @Override
  public void append(String storageKey, ChatMessage message) throws IOException {
    Path path = targetPath(storageKey, message.target());
    Files.createDirectories(path.getParent());
    String line = json.writeValueAsString(message);
    try (BufferedWriter w =
        Files.newBufferedWriter(
            path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
      w.write(line);
      w.write('\n');
    }
  }

  @Override
  public List<ChatMessage> readAll(String storageKey, String target) throws IOException {
    Path path = targetPath(storageKey, target);
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      return List.of();
    }

    List<ChatMessage> out = new ArrayList<>(lines.size());
    for (String line : lines) {
      if (line.isBlank()) continue;
      try {
        out.add(json.readValue(line, ChatMessage.class));
      } catch (JsonProcessingException e) {
        log.warn("Skipping unreadable scrollback line in {}: {}", path, e.getOriginalMessage());
      }
    }
    return out;
  }

  Path targetPath(String storageKey, String target) {
    return baseDir
        .resolve(sanitizeComponent(storageKey))
        .resolve(sanitizeComponent(target) + ".jsonl");
  }

  /** Keeps {@code [A-Za-z0-9._-]}, replaces everything else with '_'. Never empty or a dot path. */
  static String sanitizeComponent(String input) {
    String s = Objects.toString(input, "");
    StringBuilder sb = new StringBuilder(s.length());
    s.codePoints().forEach(c -> {
      boolean keep =
          (c >= 'a' && c <= 'z')
              || (c >= 'A' && c <= 'Z')
              || (c >= '0' && c <= '9')
              || c == '-'
              || c == '_'
              || c == '.';
      sb.append(keep ? (char) c : '_');
    });
    String out = sb.toString();
    if (out.isEmpty()) return "_";
    // "." and ".." would resolve outside the directory they are meant to name.
    if (out.equals(".") || out.equals("..")) return out.replace('.', '_');
    return out;
  }
}
