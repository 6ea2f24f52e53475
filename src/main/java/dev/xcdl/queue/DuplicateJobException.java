package dev.xcdl.queue;

/** Thrown when an item is enqueued while a job for it is already waiting */
public class DuplicateJobException extends RuntimeException {
	private final String itemId;

	public DuplicateJobException(String itemId) {
		super("Item already queued: " + itemId);
		this.itemId = itemId;
	}

	public String itemId() {
		return itemId;
	}
}
