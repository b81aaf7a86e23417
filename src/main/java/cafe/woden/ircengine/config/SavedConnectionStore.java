package cafe.woden.ircengine.config;

import cafe.woden.ircengine.connection.ConnectionConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Saved connection profiles, persisted as a JSON array.
 *
 * <p>Profiles are unique by {@code server:port:nickname} and kept sorted that way, both in memory
 * and on disk. Every change rewrites the whole file and publishes the new list on
 * {@link #updates()}.
 *
 * <p>Entries that fail to load are skipped, and the file is copied to {@code <name>.bad} before
 * anything rewrites it.
 */
@Component
public class SavedConnectionStore {

  private static final Logger log = LoggerFactory.getLogger(SavedConnectionStore.class);

  private final Path file;
  private final ObjectMapper mapper;
  private final List<ConnectionConfig> profiles = new ArrayList<>();
  private final BehaviorProcessor<List<ConnectionConfig>> updates = BehaviorProcessor.create();

  @Autowired
  public SavedConnectionStore(IrcEngineProperties props) {
    this(props.storage().connectionsFile(), new ObjectMapper());
  }

  SavedConnectionStore(Path file, ObjectMapper mapper) {
    this.file = Objects.requireNonNull(file, "file");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    profiles.addAll(load());
    profiles.sort(ConnectionConfig.PROFILE_ORDER);
    updates.onNext(snapshot());
  }

  public synchronized List<ConnectionConfig> list() {
    return snapshot();
  }

  /**
   * Replaces the profile with the same {@code server:port:nickname}, or adds it, then persists.
   *
   * @throws UncheckedIOException if the file can't be written; memory is left unchanged
   */
  public synchronized void upsert(ConnectionConfig config) {
    Objects.requireNonNull(config, "config");
    List<ConnectionConfig> next = new ArrayList<>(profiles);
    next.removeIf(config::sameIdentity);
    next.add(config);
    next.sort(ConnectionConfig.PROFILE_ORDER);

    write(next);
    profiles.clear();
    profiles.addAll(next);
    updates.onNext(snapshot());
  }

  public Flowable<List<ConnectionConfig>> updates() {
    return updates.onBackpressureLatest();
  }

  Path file() {
    return file;
  }

  private List<ConnectionConfig> load() {
    byte[] json;
    try {
      json = Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      return List.of();
    } catch (IOException e) {
      log.warn("Could not read saved connections from {}; starting empty", file, e);
      return List.of();
    }
    if (json.length == 0) return List.of();

    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (IOException e) {
      log.warn("Saved connections in {} are not valid JSON; starting empty", file, e);
      quarantine();
      return List.of();
    }
    if (root == null || root.isNull() || root.isMissingNode()) return List.of();
    if (!root.isArray()) {
      log.warn("Saved connections in {} are not a JSON array; starting empty", file);
      quarantine();
      return List.of();
    }

    List<ConnectionConfig> out = new ArrayList<>();
    int skipped = 0;
    for (JsonNode entry : root) {
      if (entry.isNull()) continue;
      ConnectionConfig c;
      try {
        c = mapper.treeToValue(entry, ConnectionConfig.class);
      } catch (JsonProcessingException | IllegalArgumentException e) {
        log.warn("Skipping unreadable saved connection in {}: {}", file, e.getMessage());
        skipped++;
        continue;
      }
      if (c == null) continue;
      out.removeIf(c::sameIdentity);
      out.add(c);
    }
    if (skipped > 0) quarantine();
    log.info("Loaded {} saved connection(s) from {}", out.size(), file);
    return out;
  }

  /** Copies the file as found to {@code <name>.bad} so the next rewrite can't lose it. */
  private void quarantine() {
    Path bad = badFile();
    try {
      Files.copy(file, bad, StandardCopyOption.REPLACE_EXISTING);
      log.warn("Kept a copy of the original saved connections at {}", bad);
    } catch (IOException e) {
      log.warn("Could not copy saved connections to {}", bad, e);
    }
  }

  Path badFile() {
    return file.resolveSibling(file.getFileName() + ".bad");
  }

  private void write(List<ConnectionConfig> toWrite) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(tmp.toFile(), toWrite);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not write saved connections to " + file, e);
    }
  }

  private List<ConnectionConfig> snapshot() {
    return List.copyOf(profiles);
  }
}
