package dev.xcdl.util;

import dev.xcdl.catalog.TransferStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** Utility class for HTTP operations */
public class HttpUtils {

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	// Some providers reject requests without a browser user agent
	public static final String USER_AGENT =
			"Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

	private static final int DEFAULT_MAX_RETRIES = 3;
	private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);
	private static final Duration API_TIMEOUT = Duration.ofSeconds(15);

	private final HttpClient httpClient;
	private final int maxRetries;
	private final Duration initialBackoff;

	public HttpUtils() {
		this(DEFAULT_MAX_RETRIES, INITIAL_BACKOFF);
	}

	public HttpUtils(int maxRetries, Duration initialBackoff) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
		this.maxRetries = Math.max(1, maxRetries);
		this.initialBackoff = initialBackoff;
	}

	/** Download content from a URL as a string, retrying on I/O errors */
	public String downloadString(String url) throws IOException, InterruptedException {
		return retry(() -> {
			HttpRequest request = request(url).timeout(API_TIMEOUT).build();
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			if (!isSuccess(response.statusCode())) {
				throw new IOException(
						"Failed to download content: " + redact(url) + " - HTTP status: " + response.statusCode());
			}
			return response.body();
		});
	}

	/**
	 * Open a streamed download. The transfer is never retried; the caller owns the returned stream.
	 *
	 * @param url The URL to download
	 * @return The open transfer
	 * @throws IOException on connection errors or a non-success status
	 */
	public TransferStream openStream(String url) throws IOException {
		HttpResponse<InputStream> response;
		try {
			response = httpClient.send(request(url).build(), HttpResponse.BodyHandlers.ofInputStream());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted while connecting to " + redact(url), e);
		}
		if (!isSuccess(response.statusCode())) {
			response.body().close();
			throw new IOException(
					"Failed to download file: " + redact(url) + " - HTTP status: " + response.statusCode());
		}
		long length = response.headers().firstValueAsLong("Content-Length").orElse(0L);
		return new HttpTransferStream(response.body(), Math.max(0L, length));
	}

	private HttpRequest.Builder request(String url) throws IOException {
		URI uri;
		try {
			uri = URI.create(url);
		} catch (IllegalArgumentException e) {
			// Not chained: the cause message carries the full URL
			throw new IOException("Invalid URL: " + redact(url));
		}
		return HttpRequest.newBuilder()
				.uri(uri)
				.header("User-Agent", USER_AGENT)
				.GET();
	}

	/**
	 * Shorten a URL for messages and logs. Query strings and all path segments but the last are
	 * dropped, since provider URLs carry the account credentials in both.
	 */
	static String redact(String url) {
		String location = url.replaceFirst("[?#].*$", "");
		int schemeEnd = location.indexOf("://");
		int authorityStart = schemeEnd < 0 ? 0 : schemeEnd + 3;
		int pathStart = location.indexOf('/', authorityStart);
		String authority =
				pathStart < 0 ? location.substring(authorityStart) : location.substring(authorityStart, pathStart);
		String prefix = location.substring(0, authorityStart) + authority.substring(authority.lastIndexOf('@') + 1);
		if (pathStart < 0) {
			return prefix;
		}
		int lastSlash = location.lastIndexOf('/');
		String name = location.substring(lastSlash + 1);
		return lastSlash == pathStart ? prefix + "/" + name : prefix + "/.../" + name;
	}

	private static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}

	/**
	 * Retry an operation with exponential backoff
	 *
	 * @param operation The operation to retry
	 * @return The result of the operation
	 * @throws IOException If all retry attempts fail
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < maxRetries; attempt++) {
			try {
				return operation.get();
			} catch (IOException e) {
				lastException = e;
				if (attempt < maxRetries - 1) {
					// Exponential backoff: 2s, 4s, 8s, ...
					long backoffMillis = initialBackoff.toMillis() * (1L << attempt);
					Thread.sleep(backoffMillis);
				}
			}
		}
		throw lastException;
	}

	private record HttpTransferStream(InputStream body, long contentLength) implements TransferStream {
		@Override
		public void close() throws IOException {
			body.close();
		}
	}
}
