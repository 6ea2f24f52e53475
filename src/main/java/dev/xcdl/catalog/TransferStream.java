package dev.xcdl.catalog;

import java.io.IOException;
import java.io.InputStream;

/** An open, streamed transfer of a media file. Closing it releases the connection. */
public interface TransferStream extends AutoCloseable {

	InputStream body();

	/** Advertised length in bytes, or 0 when the server did not send one */
	long contentLength();

	@Override
	void close() throws IOException;
}
