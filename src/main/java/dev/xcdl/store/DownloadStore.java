package dev.xcdl.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.xcdl.model.DownloadRecord;
import dev.xcdl.util.FileUtils;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable mapping from item id to {@link DownloadRecord}, held in memory and mirrored to a JSON
 * file. Every write goes to a temporary file in the same directory which is then moved over the
 * backing file, so the backing file always holds a complete snapshot. The in-memory map only
 * changes once the corresponding write has succeeded.
 */
public class DownloadStore {
	private static final Logger logger = LoggerFactory.getLogger(DownloadStore.class);

	private static final TypeReference<Map<String, DownloadRecord>> RECORDS_TYPE = new TypeReference<>() {};

	/** Moves the written temporary file over the backing file */
	@FunctionalInterface
	interface FileMover {
		void move(Path source, Path target) throws IOException;
	}

	private final Path storeFile;
	private final FileMover mover;
	private final ObjectMapper mapper = JsonMapper.builder()
			.enable(SerializationFeature.INDENT_OUTPUT)
			.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
			.build();

	private Map<String, DownloadRecord> records = new TreeMap<>();

	public DownloadStore(Path storeFile) {
		this(storeFile, DownloadStore::atomicMove);
	}

	DownloadStore(Path storeFile, FileMover mover) {
		this.storeFile = storeFile;
		this.mover = mover;
	}

	/**
	 * Load the backing file. A missing file gives an empty store. A file that cannot be parsed is
	 * renamed to {@code <name>.backup} and the store starts empty.
	 */
	public synchronized void load() {
		if (!Files.exists(storeFile)) {
			logger.info("No download records at {}, starting empty", storeFile);
			records = new TreeMap<>();
			return;
		}
		try {
			Map<String, DownloadRecord> loaded = mapper.readValue(storeFile.toFile(), RECORDS_TYPE);
			records = loaded == null ? new TreeMap<>() : new TreeMap<>(loaded);
			logger.info("Loaded {} download records from {}", records.size(), storeFile);
		} catch (IOException e) {
			Path backup = backupFile();
			logger.warn("Download records at {} are unreadable ({}), moving them to {}", storeFile, e.getMessage(), backup);
			try {
				Files.move(storeFile, backup, StandardCopyOption.REPLACE_EXISTING);
			} catch (IOException moveError) {
				logger.error("Failed to back up {}: {}", storeFile, moveError.getMessage());
			}
			records = new TreeMap<>();
		}
	}

	/**
	 * Write all records to the backing file.
	 *
	 * @return true when the write completed
	 */
	public synchronized boolean save() {
		return write(records);
	}

	/**
	 * Insert or replace the record of an item, stamped with the current time, and save.
	 *
	 * @return true when the record was durably written
	 */
	public synchronized boolean record(String itemId, String filename, double sizeMegabytes) {
		Map<String, DownloadRecord> updated = new TreeMap<>(records);
		updated.put(itemId, new DownloadRecord(Instant.now().getEpochSecond(), filename, sizeMegabytes));
		if (!write(updated)) {
			return false;
		}
		records = updated;
		logger.debug("Recorded {} as downloaded ({})", itemId, filename);
		return true;
	}

	/**
	 * Record an item as downloaded to a file, taking the size from the file when it is readable.
	 * A missing file is recorded with a size of 0.
	 *
	 * @return true when the record was durably written
	 */
	public boolean recordFile(String itemId, String filename, Path file) {
		double size = 0;
		if (file != null && Files.isRegularFile(file)) {
			try {
				size = FileUtils.toMegabytes(FileUtils.getFileSize(file));
			} catch (IOException e) {
				logger.debug("Cannot read size of {}: {}", file, e.getMessage());
			}
		}
		return record(itemId, filename, size);
	}

	/** Remove the record of an item and save */
	public synchronized StoreUpdate remove(String itemId) {
		if (!records.containsKey(itemId)) {
			return StoreUpdate.NOT_FOUND;
		}
		Map<String, DownloadRecord> updated = new TreeMap<>(records);
		updated.remove(itemId);
		if (!write(updated)) {
			return StoreUpdate.WRITE_FAILED;
		}
		records = updated;
		return StoreUpdate.UPDATED;
	}

	public synchronized boolean contains(String itemId) {
		return records.containsKey(itemId);
	}

	/** True when an item other than the given one has a record with this file name */
	public synchronized boolean isFilenameRecorded(String filename, String exceptItemId) {
		return records.entrySet().stream()
				.anyMatch(e -> !e.getKey().equals(exceptItemId) && filename.equals(e.getValue().filename()));
	}

	public synchronized Optional<DownloadRecord> get(String itemId) {
		return Optional.ofNullable(records.get(itemId));
	}

	/** Sorted, unmodifiable copy of all records */
	public synchronized Map<String, DownloadRecord> all() {
		return Collections.unmodifiableMap(new TreeMap<>(records));
	}

	public synchronized int size() {
		return records.size();
	}

	public Path storeFile() {
		return storeFile;
	}

	Path backupFile() {
		return storeFile.resolveSibling(storeFile.getFileName() + ".backup");
	}

	private boolean write(Map<String, DownloadRecord> snapshot) {
		Path dir = storeFile.toAbsolutePath().getParent();
		Path temp = null;
		try {
			temp = Files.createTempFile(dir, storeFile.getFileName().toString(), ".tmp");
			try (Writer writer = Files.newBufferedWriter(temp)) {
				mapper.writeValue(writer, snapshot);
			}
			mover.move(temp, storeFile);
			return true;
		} catch (IOException e) {
			logger.error("Failed to write download records to {}: {}", storeFile, e.getMessage());
			if (temp != null) {
				try {
					Files.deleteIfExists(temp);
				} catch (IOException cleanupError) {
					logger.debug("Could not remove {}: {}", temp, cleanupError.getMessage());
				}
			}
			return false;
		}
	}

	private static void atomicMove(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
