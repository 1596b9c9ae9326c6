package org.arenasync.arena.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.StorageUnavailableException;
import org.arenasync.arena.leaderboard.LeaderboardEntry;
import org.arenasync.arena.leaderboard.LeaderboardSnapshot;
import org.arenasync.arena.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Player store keeping one JSON document per player under
 * {@code <directory>/<namespace>/players/}. Writes go to a temp file that is atomically
 * moved into place, so readers never see a partial document. The periodic boards live in
 * one {@code scores.json} document next to them, cached in memory after the first read.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>directory</b>: root directory (default: data)</li>
 *   <li><b>namespace</b>: subdirectory isolating one arena region (default: arena)</li>
 * </ul>
 */
public class FileSystemPlayerStore extends AbstractResource implements IPlayerStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemPlayerStore.class);
    private static final String SUFFIX = ".json";

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Path playersDirectory;
    private final Path leaderboardFile;
    private final Path scoresFile;
    private ScoreBoards scores;

    record StoredPlayer(String playerId, String displayName, long bestScore, Set<String> moderationFlags,
                        Instant lastSeen, long plays, Instant createdAt) {
    }

    record StoredEntry(String playerId, String displayName, long score, int rank) {
    }

    record StoredLeaderboard(long version, Instant publishedAt, List<StoredEntry> entries) {
    }

    record StoredBoard(String scope, String period, List<PeriodicScore> rows) {
    }

    public FileSystemPlayerStore(String name, Config options) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "directory", "data",
            "namespace", "arena"
        ));
        Config config = options.withFallback(defaults);
        Path root = Paths.get(config.getString("directory")).toAbsolutePath().resolve(config.getString("namespace"));
        this.playersDirectory = root.resolve("players");
        this.leaderboardFile = root.resolve("leaderboard" + SUFFIX);
        this.scoresFile = root.resolve("scores" + SUFFIX);
        try {
            Files.createDirectories(playersDirectory);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to create player directory: " + playersDirectory, e);
        }
    }

    @Override
    public synchronized Optional<PlayerRecord> read(PlayerId playerId) throws StorageUnavailableException {
        Path file = fileOf(playerId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(toRecord(mapper.readValue(file.toFile(), StoredPlayer.class)));
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read player " + playerId, e);
        }
    }

    @Override
    public synchronized void upsert(PlayerRecord record) throws StorageUnavailableException {
        PlayerRecord merged = read(record.playerId()).map(existing -> existing.merge(record)).orElse(record);
        try {
            writeAtomically(fileOf(record.playerId()), mapper.writeValueAsBytes(toStored(merged)));
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write player " + record.playerId(), e);
        }
    }

    @Override
    public synchronized List<PlayerRecord> top(int limit) throws StorageUnavailableException {
        List<PlayerRecord> all = new ArrayList<>();
        try (Stream<Path> files = Files.list(playersDirectory)) {
            for (Path file : files.filter(path -> path.getFileName().toString().endsWith(SUFFIX)).toList()) {
                all.add(toRecord(mapper.readValue(file.toFile(), StoredPlayer.class)));
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to list players in " + playersDirectory, e);
        }
        all.sort(PlayerRecord.BY_BEST_SCORE);
        return all.size() <= limit ? all : new ArrayList<>(all.subList(0, limit));
    }

    @Override
    public synchronized void recordScore(ScoreSubmission submission) throws StorageUnavailableException {
        ScoreBoards boards = loadScores();
        if (!boards.record(submission)) {
            return;
        }
        List<StoredBoard> stored = new ArrayList<>();
        for (BoardScope scope : BoardScope.values()) {
            for (ScorePeriod period : ScorePeriod.values()) {
                stored.add(new StoredBoard(scope.key(), period.key(), boards.rows(scope, period)));
            }
        }
        try {
            writeAtomically(scoresFile, mapper.writeValueAsBytes(stored));
        } catch (IOException e) {
            // The cached boards now hold a row the file lacks; reload on the next call.
            scores = null;
            throw new StorageUnavailableException("Failed to write periodic scores", e);
        }
    }

    @Override
    public synchronized List<PeriodicScore> topScores(BoardScope scope, ScorePeriod period, Instant now, int limit)
            throws StorageUnavailableException {
        return loadScores().top(scope, period, now, limit);
    }

    private ScoreBoards loadScores() throws StorageUnavailableException {
        if (scores != null) {
            return scores;
        }
        ScoreBoards boards = new ScoreBoards();
        if (Files.exists(scoresFile)) {
            try {
                for (StoredBoard board : mapper.readValue(scoresFile.toFile(), new TypeReference<List<StoredBoard>>() { })) {
                    boards.restore(BoardScope.parse(board.scope()), ScorePeriod.parse(board.period()), board.rows());
                }
            } catch (IOException e) {
                throw new StorageUnavailableException("Failed to read periodic scores", e);
            }
        }
        scores = boards;
        return boards;
    }

    @Override
    public synchronized void saveLeaderboard(LeaderboardSnapshot snapshot) throws StorageUnavailableException {
        List<StoredEntry> entries = snapshot.entries().stream()
            .map(entry -> new StoredEntry(entry.playerId().value(), entry.displayName(), entry.score(), entry.rank()))
            .toList();
        try {
            writeAtomically(leaderboardFile, mapper.writeValueAsBytes(new StoredLeaderboard(snapshot.version(), snapshot.publishedAt(), entries)));
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write leaderboard", e);
        }
    }

    @Override
    public synchronized Optional<LeaderboardSnapshot> loadLeaderboard() throws StorageUnavailableException {
        if (!Files.exists(leaderboardFile)) {
            return Optional.empty();
        }
        try {
            StoredLeaderboard stored = mapper.readValue(leaderboardFile.toFile(), StoredLeaderboard.class);
            List<LeaderboardEntry> entries = stored.entries().stream()
                .map(entry -> new LeaderboardEntry(new PlayerId(entry.playerId()), entry.displayName(), entry.score(), entry.rank()))
                .toList();
            return Optional.of(new LeaderboardSnapshot(stored.version(), stored.publishedAt(), entries));
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read leaderboard", e);
        }
    }

    private void writeAtomically(Path file, byte[] data) throws IOException {
        Path tempFile = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(tempFile, data);
        try {
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile);
            }
            throw e;
        }
    }

    private Path fileOf(PlayerId playerId) {
        String key = playerId.value();
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '-' || c == '_')) {
                throw new IllegalArgumentException("Player id contains invalid character '" + c + "': " + key);
            }
        }
        return playersDirectory.resolve(key + SUFFIX);
    }

    private static StoredPlayer toStored(PlayerRecord record) {
        return new StoredPlayer(record.playerId().value(), record.displayName(), record.bestScore(),
            record.moderationFlags(), record.lastSeen(), record.plays(), record.createdAt());
    }

    private static PlayerRecord toRecord(StoredPlayer stored) {
        return new PlayerRecord(new PlayerId(stored.playerId()), stored.displayName(), stored.bestScore(),
            stored.moderationFlags() == null ? Set.of() : stored.moderationFlags(),
            stored.lastSeen(), stored.plays(), stored.createdAt());
    }
}
