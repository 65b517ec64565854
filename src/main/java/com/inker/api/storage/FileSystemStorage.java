package com.inker.api.storage;

import com.inker.api.BackendUnavailableException;
import com.inker.api.utils.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.IdGenerator;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * the in-memory storage plus a JSON snapshot on disk, rewritten after every change by
 * writing a temporary file and moving it over the old one. Only one process may use a
 * given directory at a time.
 */
class FileSystemStorage extends InMemoryStorage {

	static final String SNAPSHOT_FILE_NAME = "storage.json";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final AtomicBoolean loaded = new AtomicBoolean();

	private final Object monitor = new Object();

	private final Path directory;

	private final Path snapshotFile;

	FileSystemStorage(Path directory, IdGenerator idGenerator, Clock clock) {
		super(idGenerator, clock);
		this.directory = directory;
		this.snapshotFile = directory.resolve(SNAPSHOT_FILE_NAME);
	}

	@Override
	public void initialize() {
		if (!this.loaded.compareAndSet(false, true))
			return;
		try {
			Files.createDirectories(this.directory);
			if (Files.exists(this.snapshotFile)) {
				var snapshot = JsonUtils.mapper().readValue(this.snapshotFile.toFile(), Snapshot.class);
				this.restore(snapshot);
				this.log.info("loaded {} jobs and {} posts from {}", snapshot.jobs().size(), snapshot.posts().size(),
						this.snapshotFile);
			}
			else {
				this.log.info("starting with an empty snapshot in {}", this.directory);
			}
		} //
		catch (IOException e) {
			this.loaded.set(false);
			throw new BackendUnavailableException("couldn't read the storage snapshot in " + this.directory, e);
		}
		super.initialize();
	}

	@Override
	public String schemaVersion() {
		return "file";
	}

	@Override
	public boolean healthCheck() {
		return Files.isDirectory(this.directory) && Files.isWritable(this.directory);
	}

	@Override
	protected void changed() {
		synchronized (this.monitor) {
			var tmp = this.directory.resolve(SNAPSHOT_FILE_NAME + ".tmp");
			try {
				JsonUtils.mapper().writeValue(tmp.toFile(), this.snapshot());
				try {
					Files.move(tmp, this.snapshotFile, StandardCopyOption.REPLACE_EXISTING,
							StandardCopyOption.ATOMIC_MOVE);
				} //
				catch (AtomicMoveNotSupportedException e) {
					Files.move(tmp, this.snapshotFile, StandardCopyOption.REPLACE_EXISTING);
				}
			} //
			catch (IOException e) {
				throw new BackendUnavailableException("couldn't write the storage snapshot to " + this.snapshotFile,
						e);
			}
		}
	}

}
