package dev.xcdl.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

/** Persisted proof that an item has been downloaded. Keyed by item id in the record store. */
@JsonPropertyOrder({"downloaded_at", "filename", "size_mb"})
public record DownloadRecord(
		@JsonProperty("downloaded_at") long downloadedAt,
		@JsonProperty("filename") String filename,
		@JsonProperty("size_mb") double sizeMegabytes) {

	public Instant downloadedAtInstant() {
		return Instant.ofEpochSecond(downloadedAt);
	}
}
